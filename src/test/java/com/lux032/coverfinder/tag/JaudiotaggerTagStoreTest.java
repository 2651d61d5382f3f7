package com.lux032.coverfinder.tag;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;
import com.lux032.coverfinder.support.Mp3Fixtures;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.mp3.MP3File;
import org.jaudiotagger.tag.id3.ID3v23Tag;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JaudiotaggerTagStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldOpenUntaggedFileWithoutWritingIt() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "silence.mp3");
        byte[] before = Files.readAllBytes(file);

        TagStore store = JaudiotaggerTagStore.open(file);

        assertThat(store.getPath()).isEqualTo(file);
        assertThat(store.getAll(TagField.ALBUM)).isEmpty();
        assertThat(store.getFirst(TagField.TRACK)).isNull();
        assertThat(store.hasArtwork()).isFalse();
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void shouldPersistFieldsTrackAndSingleArtwork() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "song.mp3");

        TagStore store = JaudiotaggerTagStore.open(file);
        store.add(TagField.ALBUM, "Discovery");
        store.add(TagField.ARTIST, "Daft Punk");
        store.add(TagField.TITLE, "One More Time");
        store.add(TagField.TRACK, "3/12");
        store.replaceArtwork(new byte[25_000], "image/jpeg; charset=binary");
        store.persist(TagVersion.ID3_V23);

        TagStore reopened = JaudiotaggerTagStore.open(file);
        assertThat(reopened.getAll(TagField.ALBUM)).containsExactly("Discovery");
        assertThat(reopened.getFirst(TagField.ARTIST)).isEqualTo("Daft Punk");
        assertThat(reopened.getFirst(TagField.TITLE)).isEqualTo("One More Time");
        assertThat(reopened.getFirst(TagField.TRACK)).isEqualTo("3/12");
        assertThat(reopened.artworkCount()).isEqualTo(1);
        assertThat(((MP3File) AudioFileIO.read(file.toFile())).getID3v2Tag()).isInstanceOf(ID3v23Tag.class);
    }

    @Test
    void shouldReplaceRatherThanAccumulateArtwork() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "art.mp3");

        for (int run = 0; run < 3; run++) {
            TagStore store = JaudiotaggerTagStore.open(file);
            store.replaceArtwork(new byte[21_000 + run], "image/png");
            store.persist(TagVersion.ID3_V23);
        }

        assertThat(JaudiotaggerTagStore.open(file).artworkCount()).isEqualTo(1);
    }

    @Test
    void shouldDeleteAllValuesOfField() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "delete.mp3");
        TagStore store = JaudiotaggerTagStore.open(file);
        store.add(TagField.ALBUM, "Old");
        store.add(TagField.TRACK, "1/9");
        store.persist(TagVersion.ID3_V23);

        TagStore reopened = JaudiotaggerTagStore.open(file);
        reopened.deleteAll(TagField.ALBUM);
        reopened.deleteAll(TagField.TRACK);
        reopened.add(TagField.TRACK, "2");
        reopened.persist(TagVersion.ID3_V23);

        TagStore result = JaudiotaggerTagStore.open(file);
        assertThat(result.getAll(TagField.ALBUM)).isEmpty();
        assertThat(result.getFirst(TagField.TRACK)).isEqualTo("2");
    }

    @Test
    void shouldConvertToId3v24WhenRequested() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "v24.mp3");
        TagStore store = JaudiotaggerTagStore.open(file);
        store.add(TagField.ALBUM, "Discovery");
        store.persist(TagVersion.ID3_V24);

        MP3File mp3 = (MP3File) AudioFileIO.read(file.toFile());
        assertThat(mp3.getID3v2Tag()).isInstanceOf(ID3v24Tag.class);
        assertThat(JaudiotaggerTagStore.open(file).getFirst(TagField.ALBUM)).isEqualTo("Discovery");
    }

    @Test
    void shouldKeepGenreNameWhenConvertingToId3v24() throws Exception {
        Path file = Mp3Fixtures.silentMp3(tempDir, "genre.mp3");
        TagStore store = JaudiotaggerTagStore.open(file);
        store.add(TagField.GENRE, "Electronic");
        store.persist(TagVersion.ID3_V24);

        assertThat(JaudiotaggerTagStore.open(file).getAll(TagField.GENRE)).containsExactly("Electronic");
    }

    @Test
    void shouldFailToOpenNonAudioFile() throws Exception {
        Path file = Files.write(tempDir.resolve("notes.mp3"), "not audio".getBytes());

        assertThatThrownBy(() -> JaudiotaggerTagStore.open(file))
            .isInstanceOf(TagStoreException.class)
            .hasMessageStartingWith("Cannot read tags");
    }

    @Test
    void shouldNormalizeMimeType() {
        assertThat(JaudiotaggerTagStore.normalizeMimeType("Image/JPEG; charset=binary")).isEqualTo("image/jpeg");
        assertThat(JaudiotaggerTagStore.normalizeMimeType(null)).isEqualTo("image/jpeg");
        assertThat(JaudiotaggerTagStore.normalizeMimeType("image/png")).isEqualTo("image/png");
    }
}
