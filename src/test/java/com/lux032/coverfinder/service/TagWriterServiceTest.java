package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.model.Candidate;
import com.lux032.coverfinder.model.FieldOutcome;
import com.lux032.coverfinder.model.ResolvedRecord;
import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;
import com.lux032.coverfinder.model.WriteAction;
import com.lux032.coverfinder.model.WriteReport;
import com.lux032.coverfinder.support.InMemoryTagStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class TagWriterServiceTest {

    private static final byte[] COVER = new byte[30_000];

    private final RunOptions defaults = RunOptions.builder().directory(Paths.get("/music")).build();

    @Test
    void shouldWriteMissingFieldsAndArtworkWithSinglePersist() {
        InMemoryTagStore store = new InMemoryTagStore().with(TagField.TITLE, "One More Time");

        WriteReport report = new TagWriterService(defaults).apply(store, record());

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.isPersisted()).isTrue();
        assertThat(report.getArtworkAction()).isEqualTo(WriteAction.WRITE);
        assertThat(report.getImageBytes()).isEqualTo(COVER.length);
        assertThat(store.getPersistCount()).isEqualTo(1);
        assertThat(store.getPersistedVersion()).isEqualTo(TagVersion.ID3_V23);
        assertThat(store.getAll(TagField.ALBUM)).containsExactly("Discovery");
        assertThat(store.getAll(TagField.DATE)).containsExactly("2001-03-07");
        assertThat(store.getAll(TagField.GENRE)).containsExactly("House");
        assertThat(store.getAll(TagField.ARTIST)).containsExactly("Daft Punk");
        assertThat(store.getAll(TagField.TRACK)).containsExactly("1/14");
        assertThat(store.getAll(TagField.TITLE)).containsExactly("One More Time");
        assertThat(store.artworkCount()).isEqualTo(1);

        FieldOutcome title = outcome(report, TagField.TITLE);
        assertThat(title.getAction()).isEqualTo(WriteAction.KEEP);
        assertThat(title.isApplied()).isFalse();
        assertThat(outcome(report, TagField.ALBUM).isApplied()).isTrue();
    }

    @Test
    void shouldBeIdempotentOnSecondRun() {
        InMemoryTagStore store = new InMemoryTagStore();
        TagWriterService writer = new TagWriterService(defaults);
        writer.apply(store, record());
        int mutationsAfterFirstRun = store.getMutationCount();

        WriteReport second = writer.apply(store, record());

        assertThat(second.isPersisted()).isFalse();
        assertThat(second.getArtworkAction()).isEqualTo(WriteAction.KEEP);
        assertThat(second.getFieldOutcomes()).extracting(FieldOutcome::getAction)
            .containsOnly(WriteAction.KEEP);
        assertThat(store.getMutationCount()).isEqualTo(mutationsAfterFirstRun);
        assertThat(store.getPersistCount()).isEqualTo(1);
        assertThat(store.artworkCount()).isEqualTo(1);
    }

    @Test
    void shouldReplaceExistingImagesWhenForced() {
        InMemoryTagStore store = new InMemoryTagStore()
            .withArtwork(new byte[]{1})
            .withArtwork(new byte[]{2});
        RunOptions forced = defaults.toBuilder().force(true).build();

        WriteReport report = new TagWriterService(forced).apply(store, record());

        assertThat(report.getArtworkAction()).isEqualTo(WriteAction.OVERWRITE);
        assertThat(store.getArtwork()).containsExactly(COVER);
    }

    @Test
    void shouldOverwriteOnlyFieldsWithUpdateFlagAndForce() {
        InMemoryTagStore store = new InMemoryTagStore()
            .with(TagField.ALBUM, "Old Album")
            .with(TagField.ALBUM, "Older Album")
            .with(TagField.GENRE, "Pop");
        RunOptions options = defaults.toBuilder().force(true).updateField(TagField.ALBUM).build();

        WriteReport report = new TagWriterService(options).apply(store, record());

        assertThat(store.getAll(TagField.ALBUM)).containsExactly("Discovery");
        assertThat(store.getAll(TagField.GENRE)).containsExactly("Pop");
        assertThat(outcome(report, TagField.ALBUM).getAction()).isEqualTo(WriteAction.OVERWRITE);
        assertThat(outcome(report, TagField.GENRE).getAction()).isEqualTo(WriteAction.KEEP);
    }

    @Test
    void shouldKeepExistingValueWithUpdateFlagButWithoutForce() {
        InMemoryTagStore store = new InMemoryTagStore().with(TagField.ALBUM, "Old Album");
        RunOptions options = defaults.toBuilder().updateField(TagField.ALBUM).build();

        WriteReport report = new TagWriterService(options).apply(store, record());

        assertThat(store.getAll(TagField.ALBUM)).containsExactly("Old Album");
        assertThat(outcome(report, TagField.ALBUM).getAction()).isEqualTo(WriteAction.KEEP);
    }

    @Test
    void shouldStillWriteFieldsWhenArtworkIsKept() {
        InMemoryTagStore store = new InMemoryTagStore().withArtwork(new byte[]{9});

        WriteReport report = new TagWriterService(defaults).apply(store, record());

        assertThat(report.isArtworkKept()).isTrue();
        assertThat(report.getImageBytes()).isZero();
        assertThat(store.getArtwork()).containsExactly(new byte[]{9});
        assertThat(store.getAll(TagField.ALBUM)).containsExactly("Discovery");
        assertThat(store.getPersistCount()).isEqualTo(1);
    }

    @Test
    void shouldNotAttemptUndiscoveredFields() {
        ResolvedRecord sparse = ResolvedRecord.of(Candidate.builder()
            .source("MusicBrainz")
            .albumTitle("Discovery")
            .build());
        InMemoryTagStore store = new InMemoryTagStore();

        WriteReport report = new TagWriterService(defaults).apply(store, sparse);

        assertThat(report.getArtworkAction()).isEqualTo(WriteAction.NONE);
        assertThat(outcome(report, TagField.GENRE).isAttempted()).isFalse();
        assertThat(outcome(report, TagField.TRACK).isAttempted()).isFalse();
        assertThat(store.getAll(TagField.ALBUM)).containsExactly("Discovery");
        assertThat(store.artworkCount()).isZero();
    }

    @Test
    void shouldNeverMutateInDryRun() {
        InMemoryTagStore store = new InMemoryTagStore();
        RunOptions dryRun = defaults.toBuilder().dryRun(true).build();

        WriteReport report = new TagWriterService(dryRun).apply(store, record());

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.isPersisted()).isFalse();
        assertThat(report.getImageBytes()).isEqualTo(COVER.length);
        assertThat(outcome(report, TagField.ALBUM).getAction()).isEqualTo(WriteAction.WRITE);
        assertThat(outcome(report, TagField.ALBUM).isApplied()).isFalse();
        assertThat(store.getMutationCount()).isZero();
        assertThat(store.getPersistCount()).isZero();
    }

    @Test
    void shouldReportPersistFailureInsteadOfThrowing() {
        InMemoryTagStore store = new InMemoryTagStore().failingOnPersist();

        WriteReport report = new TagWriterService(defaults).apply(store, record());

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getMessage()).contains("disk full");
        assertThat(report.getFieldOutcomes()).extracting(FieldOutcome::isApplied).containsOnly(false);
    }

    @Test
    void shouldPersistAtSelectedVersion() {
        InMemoryTagStore store = new InMemoryTagStore();
        RunOptions v24 = defaults.toBuilder().tagVersion(TagVersion.ID3_V24).build();

        new TagWriterService(v24).apply(store, record());

        assertThat(store.getPersistedVersion()).isEqualTo(TagVersion.ID3_V24);
    }

    private static ResolvedRecord record() {
        return ResolvedRecord.of(Candidate.builder()
            .imageData(COVER)
            .contentType("image/jpeg")
            .source("iTunes 1200px")
            .albumTitle("Discovery")
            .releaseDate("2001-03-07")
            .genre("House")
            .genre("Electronic")
            .artistName("Daft Punk")
            .trackTitle("One More Time")
            .trackNumber(1)
            .trackCount(14)
            .build());
    }

    private static FieldOutcome outcome(WriteReport report, TagField field) {
        return report.getFieldOutcomes().stream()
            .filter(o -> o.getField() == field)
            .findFirst()
            .orElseThrow();
    }
}
