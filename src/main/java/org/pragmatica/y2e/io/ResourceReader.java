package org.pragmatica.y2e.io;

import io.vavr.control.Either;
import org.pragmatica.y2e.error.ConversionError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a named resource into text.
 */
@FunctionalInterface
public interface ResourceReader {

    Either<ConversionError, Resource> read(String name);

    /**
     * Resource names are file paths, content is UTF-8.
     */
    static ResourceReader files() {
        return name -> {
            try {
                return Either.right(Resource.of(name, Files.readString(Path.of(name), StandardCharsets.UTF_8)));
            } catch (IOException | InvalidPathException e) {
                return Either.left(new ConversionError.ResourceError(name, describe(e)));
            }
        };
    }

    /**
     * Resources held in memory, keyed by name.
     */
    static ResourceReader of(Map<String, String> resources) {
        return name -> resources.containsKey(name)
                       ? Either.right(Resource.of(name, resources.get(name)))
                       : Either.left(new ConversionError.ResourceError(name, "no such resource"));
    }

    private static String describe(Exception e) {
        return e.getMessage() == null
               ? e.getClass().getSimpleName()
               : e.getClass().getSimpleName() + " " + e.getMessage();
    }
}
