package org.flatline;

import org.flatline.flow.IndexPolicy;
import picocli.CommandLine;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

public class Main {

    private static final String VERSION = "1.0.0";

    @CommandLine.Command(name = "flatline", mixinStandardHelpOptions = true, version = "flatline " + VERSION,
            description = "Flattens the control flow of the methods of a .jar file into dispatch loops")
    static class FlattenerRunner implements Callable<Integer> {

        @CommandLine.Parameters(index = "0", description = "Jar file to flatten")
        private File jarFile;

        @CommandLine.Parameters(index = "1", description = "Output directory")
        private String outputDirectory;

        @CommandLine.Option(names = {"-l", "--libraries"}, description = "Directory for dependent libraries")
        private File librariesDirectory;

        @CommandLine.Option(names = {"-b", "--black-list"}, description = "File with a list of blacklist classes/methods")
        private File blackListFile;

        @CommandLine.Option(names = {"-w", "--white-list"}, description = "File with a list of whitelist classes/methods")
        private File whiteListFile;

        @CommandLine.Option(names = {"-a", "--annotations"}, description = "Use @Flatten/@NoFlatten to select methods")
        private boolean useAnnotations;

        @CommandLine.Option(names = {"--seed"}, description = "Seed for reproducible dispatch indices")
        private Long seed;

        @CommandLine.Option(names = {"--index-policy"}, defaultValue = "UNIQUE",
                description = "Dispatch index policy: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
        private IndexPolicy indexPolicy;

        @CommandLine.Option(names = {"--no-lower-switches"}, description = "Do not rewrite switches into comparisons; methods with switches are skipped")
        private boolean noLowerSwitches;

        @CommandLine.Option(names = {"--verify"}, description = "Verify every rewritten class with ASM's CheckClassAdapter")
        private boolean verify;

        @Override
        public Integer call() throws Exception {
            List<Path> libs = new ArrayList<>();
            if (librariesDirectory != null) {
                try (Stream<Path> files = Files.walk(librariesDirectory.toPath(), FileVisitOption.FOLLOW_LINKS)) {
                    files.filter(f -> f.toString().endsWith(".jar") || f.toString().endsWith(".zip"))
                            .forEach(libs::add);
                }
            }

            List<String> blackList = new ArrayList<>();
            if (blackListFile != null) {
                blackList = Files.readAllLines(blackListFile.toPath(), StandardCharsets.UTF_8);
            }

            List<String> whiteList = null;
            if (whiteListFile != null) {
                whiteList = Files.readAllLines(whiteListFile.toPath(), StandardCharsets.UTF_8);
            }

            FlattenerConfig config = new FlattenerConfig.Builder()
                    .setInputJarPath(jarFile.toPath())
                    .setOutputDir(Paths.get(outputDirectory))
                    .setInputLibs(libs)
                    .setBlackList(blackList)
                    .setWhiteList(whiteList)
                    .setUseAnnotations(useAnnotations)
                    .setSeed(seed)
                    .setIndexPolicy(indexPolicy)
                    .setLowerSwitches(!noLowerSwitches)
                    .setVerify(verify)
                    .build();

            config.validateAndWarn();

            new JarFlattener().process(config);

            return 0;
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new FlattenerRunner())
                .setCaseInsensitiveEnumValuesAllowed(true).execute(args));
    }
}
