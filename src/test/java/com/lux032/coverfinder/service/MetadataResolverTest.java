package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.ResolvedRecord;
import com.lux032.coverfinder.model.TrackMeta;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetadataResolverTest {

    private static final TrackMeta META = new TrackMeta("Daft Punk", "Discovery", "One More Time");

    @Mock
    private MetadataSource primary;

    @Mock
    private MetadataSource secondary;

    @Test
    void shouldAcceptFirstPrimaryCandidateWithImage() {
        AtomicInteger produced = new AtomicInteger();
        when(primary.candidates(META)).thenReturn(Stream.of(
                candidate("iTunes 1200px", null),
                candidate("iTunes 1000px", new byte[]{1, 2, 3}),
                candidate("iTunes 800px", new byte[]{4}))
            .peek(c -> produced.incrementAndGet()));

        Optional<ResolvedRecord> record = new MetadataResolver(primary, secondary).resolve(META);

        assertThat(record).isPresent();
        assertThat(record.get().getSource()).isEqualTo("iTunes 1000px");
        assertThat(produced.get()).isEqualTo(2);
        verify(secondary, never()).candidates(any());
    }

    @Test
    void shouldFallBackToSecondaryEvenWithoutImage() {
        when(primary.candidates(META)).thenReturn(Stream.empty());
        when(primary.getName()).thenReturn("iTunes");
        when(secondary.getName()).thenReturn("MusicBrainz");
        when(secondary.candidates(META)).thenReturn(Stream.of(candidate("MusicBrainz", null)));

        Optional<ResolvedRecord> record = new MetadataResolver(primary, secondary).resolve(META);

        assertThat(record).isPresent();
        assertThat(record.get().getSource()).isEqualTo("MusicBrainz");
        assertThat(record.get().hasImage()).isFalse();
    }

    @Test
    void shouldReturnEmptyWhenBothSourcesMiss() {
        when(primary.candidates(META)).thenReturn(Stream.empty());
        when(secondary.candidates(META)).thenReturn(Stream.empty());

        assertThat(new MetadataResolver(primary, secondary).resolve(META)).isEmpty();
    }

    @Test
    void shouldNormalizeGenresOfAcceptedCandidate() {
        when(primary.candidates(META)).thenReturn(Stream.of(Candidate.builder()
            .imageData(new byte[]{1})
            .source("iTunes 600px")
            .genre(" House ")
            .genre("House")
            .genre(" ")
            .genre("Electronic")
            .build()));

        ResolvedRecord record = new MetadataResolver(primary, secondary).resolve(META).orElseThrow();

        assertThat(record.getGenres()).containsExactly("House", "Electronic");
        assertThat(record.getPrimaryGenre()).isEqualTo("House");
    }

    private static Candidate candidate(String source, byte[] image) {
        return Candidate.builder()
            .source(source)
            .imageData(image)
            .albumTitle("Discovery")
            .build();
    }
}
