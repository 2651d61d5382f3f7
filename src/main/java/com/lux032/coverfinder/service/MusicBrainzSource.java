package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.TrackMeta;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * MusicBrainz + Cover Art Archive 数据源（备用数据源）
 * 第一步确定发行（专辑搜索，失败时用 艺术家+标题 搜索录音），
 * 第二步获取发行详情和正面封面，至多产生一个候选结果
 */
@Slf4j
public class MusicBrainzSource implements MetadataSource {

    private final MusicBrainzClient musicBrainzClient;
    private final CoverArtService coverArtService;

    public MusicBrainzSource(MusicBrainzClient musicBrainzClient, CoverArtService coverArtService) {
        this.musicBrainzClient = musicBrainzClient;
        this.coverArtService = coverArtService;
    }

    @Override
    public String getName() {
        return "MusicBrainz";
    }

    @Override
    public Stream<Candidate> candidates(TrackMeta meta) {
        return Stream.of(meta)
            .map(this::lookup)
            .flatMap(Optional::stream);
    }

    private Optional<Candidate> lookup(TrackMeta meta) {
        Optional<MusicBrainzClient.ReleaseRef> release = musicBrainzClient.findReleaseByAlbum(meta.getArtist(), meta.getAlbum());
        if (release.isEmpty()) {
            release = musicBrainzClient.findReleaseByRecording(meta.getArtist(), meta.getTitle());
        }
        if (release.isEmpty()) {
            log.debug("No MusicBrainz release for {}", meta);
            return Optional.empty();
        }

        MusicBrainzClient.ReleaseRef ref = release.get();
        log.debug("MusicBrainz release {} ('{}')", ref.getId(), ref.getTitle());

        MusicBrainzClient.ReleaseDetails details = musicBrainzClient.fetchReleaseDetails(ref.getId());
        Optional<FetchResponse> cover = coverArtService.fetchFrontCover(ref.getId());

        Candidate.CandidateBuilder builder = Candidate.builder()
            .albumTitle(ref.getTitle())
            .releaseDate(details.getDate())
            .genres(details.getGenres())
            .artistName(meta.getArtist())
            .trackTitle(meta.getTitle());

        if (cover.isPresent()) {
            builder.imageData(cover.get().getBody())
                .contentType(cover.get().getContentType())
                .source("CoverArtArchive");
        } else {
            builder.source("MusicBrainz");
        }
        return Optional.of(builder.build());
    }
}
