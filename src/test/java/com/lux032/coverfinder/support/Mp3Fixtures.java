package com.lux032.coverfinder.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 生成无标签的静音 MP3（MPEG-1 Layer III，128kbps，44.1kHz）
 */
public final class Mp3Fixtures {

    private static final int FRAME_LENGTH = 417;
    private static final int FRAME_COUNT = 100;

    private Mp3Fixtures() {
    }

    public static Path silentMp3(Path directory, String fileName) throws IOException {
        byte[] data = new byte[FRAME_LENGTH * FRAME_COUNT];
        for (int frame = 0; frame < FRAME_COUNT; frame++) {
            int offset = frame * FRAME_LENGTH;
            data[offset] = (byte) 0xFF;
            data[offset + 1] = (byte) 0xFB;
            data[offset + 2] = (byte) 0x90;
            data[offset + 3] = (byte) 0x00;
        }
        return Files.write(directory.resolve(fileName), data);
    }
}
