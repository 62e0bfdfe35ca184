package com.cyclerprotocol.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    /** Contents of a fixture under {@code procedures/} on the test classpath. */
    public static String procedureText(String name) throws IOException {
        try (InputStream in = open(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** Copies a procedure fixture into {@code directory} and returns the copy. */
    public static Path copyProcedure(String name, Path directory) throws IOException {
        Path target = directory.resolve(name);
        try (InputStream in = open(name)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    private static InputStream open(String name) throws IOException {
        String resourceName = "procedures/" + name;
        InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IOException("Missing classpath resource: " + resourceName);
        }
        return in;
    }
}
