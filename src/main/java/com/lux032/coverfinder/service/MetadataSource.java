package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.TrackMeta;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 外部元数据/封面数据源
 * 实现类内部处理所有网络与解析错误，不向调用方抛出异常
 */
public interface MetadataSource {

    /**
     * 数据源名称，用于日志
     */
    String getName();

    /**
     * 按优先级惰性产生候选结果，只有被消费时才会发起请求
     */
    Stream<Candidate> candidates(TrackMeta meta);

    /**
     * 产生全部候选结果
     */
    default List<Candidate> search(TrackMeta meta) {
        try (Stream<Candidate> stream = candidates(meta)) {
            return stream.collect(Collectors.toList());
        }
    }
}
