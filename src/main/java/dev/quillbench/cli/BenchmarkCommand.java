package dev.quillbench.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parsed command line. Accepts {@code --opt value} and {@code --opt=value}.
 * Options with a dotted name ({@code --spring.profiles.active=dev},
 * {@code --quillbench.benchmark.max-concurrency=2}) are Spring Boot property
 * overrides and are skipped here.
 *
 * <pre>
 *   --category &lt;string&gt;      content category (default "AI")
 *   --style &lt;string&gt;         writing style (default "tech")
 *   --controllers &lt;a,b,...&gt;  controller types (default: all registered)
 *   --model &lt;string&gt;         model passed to controller factories
 *   --output &lt;path&gt;          report destination (default: timestamped file)
 *   --verbose                 echo report head and tail to stdout
 * </pre>
 *
 * @param controllers {@code null} means every registered controller
 * @param model       {@code null} means the configured default model
 * @param output      {@code null} means the timestamped default report path
 */
public record BenchmarkCommand(String category, String style, List<String> controllers,
                               String model, Path output, boolean verbose) {

    public static final String DEFAULT_CATEGORY = "AI";
    public static final String DEFAULT_STYLE = "tech";

    public static BenchmarkCommand parse(String... args) {
        String category = DEFAULT_CATEGORY;
        String style = DEFAULT_STYLE;
        List<String> controllers = null;
        String model = null;
        Path output = null;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            if (name.contains(".")) {
                // Spring Boot property override, bound by the application context
                continue;
            }

            if (name.equals("verbose")) {
                if (inlineValue != null) throw new IllegalArgumentException("--verbose takes no value");
                verbose = true;
                continue;
            }

            String value;
            if (inlineValue != null) {
                value = inlineValue;
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("Missing value for --" + name);
            }

            switch (name) {
                case "category" -> category = value;
                case "style" -> style = value;
                case "controllers" -> controllers = splitList(value);
                case "model" -> model = value;
                case "output" -> output = Path.of(value);
                default -> throw new IllegalArgumentException("Unknown option: --" + name);
            }
        }
        return new BenchmarkCommand(category, style, controllers, model, output, verbose);
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(items::add);
        return List.copyOf(items);
    }
}
