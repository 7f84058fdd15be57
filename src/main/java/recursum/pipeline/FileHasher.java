package recursum.pipeline;

import recursum.models.*;
import recursum.utils.*;

import java.io.*;
import java.nio.file.*;

// Reads and digests one file on the calling thread.
@FunctionalInterface
public interface FileHasher {

    FileDigest hash(Path file) throws IOException;

    static FileHasher of(HashAlgorithm algorithm) {
        return file -> DigestUtils.hash(file, algorithm);
    }
}
