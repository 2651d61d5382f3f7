package com.lux032.coverfinder.tag;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.mp3.MP3File;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagOptionSingleton;
import org.jaudiotagger.tag.id3.AbstractID3v2Tag;
import org.jaudiotagger.tag.id3.ID3v23Tag;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.ArtworkFactory;
import org.jaudiotagger.tag.reference.PictureTypes;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 基于 jaudiotagger 的标签实现
 * TRACK 字段以 "n/total" 形式读写，对应 TRACK 与 TRACK_TOTAL 两个键
 */
@Slf4j
public class JaudiotaggerTagStore implements TagStore {

    static {
        // 流派以文本保存，否则 v2.3 的 "(52)" 形式转换到 v2.4 后不再被解码
        TagOptionSingleton.getInstance().setWriteMp3GenresAsText(true);
    }

    private final Path path;
    private final AudioFile audioFile;
    private final Tag tag;

    private JaudiotaggerTagStore(Path path, AudioFile audioFile, Tag tag) {
        this.path = path;
        this.audioFile = audioFile;
        this.tag = tag;
    }

    /**
     * 读取文件标签，文件没有标签时创建默认标签（不会立即写盘）
     */
    public static JaudiotaggerTagStore open(Path path) throws TagStoreException {
        try {
            AudioFile audioFile = AudioFileIO.read(path.toFile());
            Tag tag = audioFile.getTagOrCreateAndSetDefault();
            return new JaudiotaggerTagStore(path, audioFile, tag);
        } catch (Exception e) {
            throw new TagStoreException("Cannot read tags: " + e.getMessage(), e);
        }
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public List<String> getAll(TagField field) {
        try {
            if (field == TagField.TRACK) {
                String number = tag.getFirst(FieldKey.TRACK);
                if (number == null || number.trim().isEmpty()) {
                    return Collections.emptyList();
                }
                String total = tag.getFirst(FieldKey.TRACK_TOTAL);
                if (total == null || total.trim().isEmpty()) {
                    return List.of(number.trim());
                }
                return List.of(number.trim() + "/" + total.trim());
            }
            List<String> values = new ArrayList<>();
            for (String value : tag.getAll(keyFor(field))) {
                if (value != null && !value.trim().isEmpty()) {
                    values.add(value);
                }
            }
            return values;
        } catch (RuntimeException e) {
            log.debug("Cannot read {} from {}: {}", field, path.getFileName(), e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public void deleteAll(TagField field) throws TagStoreException {
        try {
            tag.deleteField(keyFor(field));
            if (field == TagField.TRACK) {
                tag.deleteField(FieldKey.TRACK_TOTAL);
            }
        } catch (RuntimeException e) {
            throw new TagStoreException("Cannot delete " + field + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void add(TagField field, String value) throws TagStoreException {
        try {
            if (field == TagField.TRACK) {
                String[] parts = value.split("/", 2);
                tag.setField(FieldKey.TRACK, parts[0].trim());
                if (parts.length > 1 && !parts[1].trim().isEmpty()) {
                    tag.setField(FieldKey.TRACK_TOTAL, parts[1].trim());
                }
                return;
            }
            FieldKey key = keyFor(field);
            if (tag.getAll(key).isEmpty()) {
                tag.setField(key, value);
            } else {
                tag.addField(key, value);
            }
        } catch (Exception e) {
            throw new TagStoreException("Cannot write " + field + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int artworkCount() {
        try {
            return tag.getArtworkList().size();
        } catch (RuntimeException e) {
            log.debug("Cannot read artwork from {}: {}", path.getFileName(), e.getMessage());
            return 0;
        }
    }

    @Override
    public void replaceArtwork(byte[] data, String mimeType) throws TagStoreException {
        try {
            Artwork artwork = ArtworkFactory.getNew();
            artwork.setBinaryData(data);
            artwork.setMimeType(normalizeMimeType(mimeType));
            artwork.setPictureType(PictureTypes.DEFAULT_ID);
            artwork.setDescription("Front cover");

            tag.deleteArtworkField();
            tag.setField(artwork);
        } catch (Exception e) {
            throw new TagStoreException("Cannot embed cover: " + e.getMessage(), e);
        }
    }

    @Override
    public void persist(TagVersion version) throws TagStoreException {
        try {
            if (audioFile instanceof MP3File) {
                convertId3Version((MP3File) audioFile, version);
            }
            audioFile.commit();
            log.debug("Saved tags to {} (ID3v{})", path.getFileName(), version.getLabel());
        } catch (Exception e) {
            throw new TagStoreException("Cannot save tags: " + e.getMessage(), e);
        }
    }

    private static void convertId3Version(MP3File mp3File, TagVersion version) {
        AbstractID3v2Tag current = mp3File.getID3v2Tag();
        if (current == null) {
            return;
        }
        if (version == TagVersion.ID3_V24 && !(current instanceof ID3v24Tag)) {
            mp3File.setID3v2Tag(new ID3v24Tag(current));
        } else if (version == TagVersion.ID3_V23 && !(current instanceof ID3v23Tag)) {
            mp3File.setID3v2Tag(new ID3v23Tag(current));
        }
    }

    /**
     * 去掉 Content-Type 中的参数部分，如 "image/jpeg; charset=binary"
     */
    static String normalizeMimeType(String contentType) {
        if (contentType == null || contentType.trim().isEmpty()) {
            return "image/jpeg";
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return mime.isEmpty() ? "image/jpeg" : mime;
    }

    private static FieldKey keyFor(TagField field) {
        switch (field) {
            case ALBUM:
                return FieldKey.ALBUM;
            case DATE:
                return FieldKey.YEAR;
            case GENRE:
                return FieldKey.GENRE;
            case ARTIST:
                return FieldKey.ARTIST;
            case TITLE:
                return FieldKey.TITLE;
            case TRACK:
                return FieldKey.TRACK;
            case ALBUM_ARTIST:
                return FieldKey.ALBUM_ARTIST;
            default:
                throw new IllegalArgumentException("Unsupported field: " + field);
        }
    }
}
