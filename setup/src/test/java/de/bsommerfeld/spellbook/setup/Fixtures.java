package de.bsommerfeld.spellbook.setup;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Copies JSON fixtures from {@code src/test/resources/fixtures} to a given path. */
public final class Fixtures {

    private Fixtures() {
    }

    public static long copyTo(String name, Path target) throws IOException {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture: " + name);
            }
            Files.createDirectories(target.toAbsolutePath().getParent());
            return Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
