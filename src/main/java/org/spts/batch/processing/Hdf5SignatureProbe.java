package org.spts.batch.processing;

import org.spts.batch.plugin.InputProbe;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Accepts files carrying the HDF5 format signature. The superblock sits at offset 0 or, after a user
 * block, at 512, 1024, 2048 and further powers of two.
 */
public class Hdf5SignatureProbe implements InputProbe {

    private static final Logger LOGGER = Logger.getLogger(Hdf5SignatureProbe.class.getName());

    static final byte[] SIGNATURE = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'};
    private static final long FIRST_USER_BLOCK_OFFSET = 512;

    @Override
    public boolean isValid(final Path input) {
        try (FileChannel channel = FileChannel.open(input, StandardOpenOption.READ)) {
            final long size = channel.size();
            if (hasSignatureAt(channel, 0)) {
                return true;
            }
            for (long offset = FIRST_USER_BLOCK_OFFSET; offset + SIGNATURE.length <= size; offset *= 2) {
                if (hasSignatureAt(channel, offset)) {
                    return true;
                }
            }
            return false;
        } catch (IOException e) {
            LOGGER.warning(String.format("Cannot probe %s: %s", input, e.getMessage()));
            return false;
        }
    }

    private static boolean hasSignatureAt(final FileChannel channel, final long offset) throws IOException {
        final ByteBuffer buffer = ByteBuffer.allocate(SIGNATURE.length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, offset + buffer.position()) < 0) {
                return false;
            }
        }
        return Arrays.equals(buffer.array(), SIGNATURE);
    }
}
