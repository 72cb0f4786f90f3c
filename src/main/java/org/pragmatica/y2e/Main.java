package org.pragmatica.y2e;

import io.vavr.control.Either;
import org.pragmatica.y2e.convert.ConverterConfig;
import org.pragmatica.y2e.ebnf.Definition;
import org.pragmatica.y2e.error.ConversionError;
import org.pragmatica.y2e.io.LineWriter;
import org.pragmatica.y2e.io.ResourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command line entry point: {@code Main <grammar> <supplement>}.
 *
 * <p>Exit codes: 0 on success, 1 when a resource cannot be read or converted, 2 on wrong usage.
 */
public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int SUCCESS = 0;
    static final int FAILURE = 1;
    static final int USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, ResourceReader.files(), LineWriter.to(System.out)));
    }

    static int run(String[] args, ResourceReader reader, LineWriter writer) {
        if (args.length != 2) {
            logger.error("Usage: java -jar java-y2e.jar <grammar> <supplement>");
            return USAGE;
        }
        logger.debug("Converting {} with supplement {}", args[0], args[1]);

        Either<ConversionError, List<Definition>> result =
            reader.read(args[0])
                  .flatMap(grammar -> reader.read(args[1])
                                            .flatMap(supplement -> EbnfConverter.convert(grammar, supplement, ConverterConfig.DEFAULT)));

        if (result.isLeft()) {
            logger.error("{}", result.getLeft().message());
            return FAILURE;
        }
        writer.write(EbnfConverter.render(result.get()));
        return SUCCESS;
    }
}
