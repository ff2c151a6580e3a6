package com.example.dedupscanner;

/**
 * Parses {@code <command> [target] [options]} into {@link CliOptions}.
 */
public class CommandLineParser {

    /**
     * @throws IllegalArgumentException if the arguments are invalid
     */
    public CliOptions parse(String[] args) {
        CliOptions options = new CliOptions();
        int i = 0;
        if (args.length > 0 && !args[0].startsWith("-")) {
            options.command = CliCommand.fromName(args[0]);
            i = 1;
        }

        for (; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "-r", "--recursive":
                    options.recursive = true;
                    break;

                case "-n", "--no-web":
                    options.web = false;
                    break;

                case "-p", "--port":
                    options.port = parsePositive(getRequiredValue(args, i, "port"), "port");
                    if (options.port > 65535) {
                        throw new IllegalArgumentException("Invalid port '" + options.port + "': must be at most 65535");
                    }
                    i++;
                    break;

                case "-i", "--index":
                    options.indexPath = getRequiredValue(args, i, "index");
                    i++;
                    break;

                case "--incomplete":
                    options.resume = true;
                    break;

                case "-e", "--exclude":
                    getRequiredValue(args, i, "exclude");
                    // Takes every following argument up to the next option.
                    while (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        options.excludePatterns.add(args[++i]);
                    }
                    break;

                case "-t", "--threads":
                    options.threadCount = parsePositive(getRequiredValue(args, i, "threads"), "threads");
                    i++;
                    break;

                case "--config":
                    options.configFile = getRequiredValue(args, i, "config");
                    i++;
                    break;

                case "--session":
                    options.sessionId = (long) parsePositive(getRequiredValue(args, i, "session"), "session");
                    i++;
                    break;

                case "-d", "--delete-index", "--duplicates":
                    if (options.command == CliCommand.GENERATE_TEST) {
                        options.duplicates = parsePositive(getRequiredValue(args, i, "duplicates"), "duplicates");
                        i++;
                    } else if ("--duplicates".equals(arg)) {
                        throw new IllegalArgumentException("--duplicates only applies to generate-test");
                    } else {
                        options.deleteIndex = true;
                    }
                    break;

                case "-c", "--count":
                    options.count = parsePositive(getRequiredValue(args, i, "count"), "count");
                    i++;
                    break;

                case "-h", "--help":
                    options.helpRequested = true;
                    break;

                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (options.target != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    options.target = arg;
                    break;
            }
        }

        validate(options);
        return options;
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: dedup-scanner <command> [options]",
                "",
                "Commands:",
                "  scan [dir]              Scan a directory for duplicate files (default: .)",
                "    -r, --recursive       Scan subdirectories",
                "    -n, --no-web          Print results instead of starting the web console",
                "    -p, --port <n>        Web console port (default: 8080)",
                "    -i, --index <path>    Index file to store the scan in",
                "    --incomplete          Resume the newest incomplete scan in the index",
                "    -e, --exclude <glob>  Glob patterns to exclude (repeatable)",
                "    -t, --threads <n>     Hashing threads",
                "    --config <file>       JSON file with scan defaults",
                "  serve <index-file>      Serve an existing index",
                "    -p, --port <n>        Web console port (default: 8080)",
                "    --session <id>        Session to serve (default: latest)",
                "  shutdown                Stop a running web console",
                "    -d, --delete-index    Delete the index file after shutdown",
                "    -p, --port <n>        Web console port (default: 8080)",
                "  generate-test [dir]     Generate duplicate test files (default: ./test-dir)",
                "    -c, --count <n>       Number of distinct files (default: 20)",
                "    -d, --duplicates <n>  Copies of each file (default: 2)");
    }

    private void validate(CliOptions options) {
        if (options.helpRequested) {
            return;
        }
        if (options.command == CliCommand.SERVE && options.target == null) {
            throw new IllegalArgumentException("serve requires the path of an index file");
        }
        if (options.resume && options.indexPath == null && options.configFile == null) {
            throw new IllegalArgumentException("--incomplete requires --index");
        }
        if (options.command == CliCommand.GENERATE_TEST && options.target == null) {
            options.target = "./test-dir";
        }
    }

    private int parsePositive(String value, String name) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
        }
    }

    private String getRequiredValue(String[] args, int index, String name) {
        if (index + 1 >= args.length || args[index + 1].startsWith("-")) {
            throw new IllegalArgumentException("Option --" + name + " requires a value");
        }
        return args[index + 1];
    }
}
