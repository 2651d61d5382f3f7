package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.ResolvedRecord;
import com.lux032.coverfinder.model.TrackMeta;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * 按固定优先级选择候选结果
 * 首选数据源中第一个带封面的结果胜出；否则采用备用数据源的结果（即使没有封面）
 */
@Slf4j
public class MetadataResolver {

    private final MetadataSource primary;
    private final MetadataSource secondary;

    public MetadataResolver(MetadataSource primary, MetadataSource secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    /**
     * @return 为空表示未命中
     */
    public Optional<ResolvedRecord> resolve(TrackMeta meta) {
        Optional<Candidate> chosen;
        try (Stream<Candidate> stream = primary.candidates(meta)) {
            chosen = stream.filter(Candidate::hasImage).findFirst();
        }
        if (chosen.isPresent()) {
            log.debug("{} matched: {}", primary.getName(), chosen.get());
            return chosen.map(ResolvedRecord::of);
        }

        log.debug("{} had no usable candidate, falling back to {}", primary.getName(), secondary.getName());
        try (Stream<Candidate> stream = secondary.candidates(meta)) {
            chosen = stream.findFirst();
        }
        chosen.ifPresent(candidate -> log.debug("{} matched: {}", secondary.getName(), candidate));
        return chosen.map(ResolvedRecord::of);
    }
}
