package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point for the music resolver.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code search <keyword> [source]}</li>
 *   <li>{@code explore} (netease search for a random popular artist)</li>
 *   <li>{@code resolve <source> <id> [quality]}</li>
 *   <li>{@code lyrics <source> <id>}</li>
 *   <li>{@code playlist <url|id>}</li>
 *   <li>{@code probe}</li>
 *   <li>{@code stats} (also exports {@code source-stats.csv} next to the stats file)</li>
 * </ul>
 * Without arguments the mode line is read from standard input.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    static final String USAGE = "Choose mode:\n"
        + "  search <keyword> [source]\n"
        + "  explore\n"
        + "  resolve <source> <id> [quality]\n"
        + "  lyrics <source> <id>\n"
        + "  playlist <url|id>\n"
        + "  probe\n"
        + "  stats\n"
        + "Enter a mode line or press Enter for 'probe': ";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        ResolverConfig config = ResolverConfig.fromEnvironment();
        int code;
        try (MusicResolverService service = MusicResolverService.create(config)) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            code = run(args, in, System.out, service, config);
        }
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs one CLI command.
     * @return Process exit code: 0 on success, 1 on a resolver failure, 2 on a usage error
     */
    static int run(String[] args, BufferedReader in, PrintStream out, MusicResolverServiceInterface service, ResolverConfig config) {
        String[] command = args == null ? new String[0] : args;
        if (command.length == 0) {
            out.print(USAGE);
            command = promptForCommand(in);
        }
        String mode = command[0].trim().toLowerCase(Locale.ROOT);
        List<String> rest = Arrays.asList(command).subList(1, command.length);
        try {
            switch (mode) {
                case "search" -> {
                    requireArgs(rest, 1, "search <keyword> [source]");
                    String source = rest.size() > 1 ? rest.get(rest.size() - 1) : "";
                    String keyword = rest.size() > 1 && ProviderRegistry.CATALOG_SOURCES.contains(source)
                        ? String.join(" ", rest.subList(0, rest.size() - 1))
                        : String.join(" ", rest);
                    if (!ProviderRegistry.CATALOG_SOURCES.contains(source)) source = "";
                    List<Song> songs = service.search(keyword, source);
                    if (songs.isEmpty()) out.println("No songs found.");
                    for (Song song : songs) {
                        out.printf("%s\t%s\t%s\t%s%n", song.source(), song.id(), song.name(), song.artistLine());
                    }
                }
                case "explore" -> {
                    List<Song> songs = service.explore();
                    if (songs.isEmpty()) out.println("No songs found.");
                    for (Song song : songs) {
                        out.printf("%s\t%s\t%s\t%s%n", song.source(), song.id(), song.name(), song.artistLine());
                    }
                }
                case "resolve" -> {
                    requireArgs(rest, 2, "resolve <source> <id> [quality]");
                    Song song = new Song(rest.get(1), rest.get(1), List.of(), rest.get(0));
                    String quality = rest.size() > 2 ? rest.get(2) : config.defaultQuality();
                    UrlResolution resolution = service.resolvePlayableUrl(song, quality);
                    out.println(resolution.url());
                    out.printf("provider=%s quality=%s preview=%s crossSource=%s%n", resolution.providerName(),
                        resolution.obtainedQuality(), resolution.preview(), resolution.crossSource());
                }
                case "lyrics" -> {
                    requireArgs(rest, 2, "lyrics <source> <id>");
                    LyricResult lyrics = service.getLyrics(new Song(rest.get(1), rest.get(1), List.of(), rest.get(0)));
                    List<LyricLine> lines = LyricParser.parse(lyrics.text());
                    if (lines.isEmpty()) out.println("No lyrics.");
                    for (LyricLine line : lines) {
                        out.printf(Locale.ROOT, "[%06.2f] %s%n", line.time(), line.text());
                    }
                }
                case "playlist" -> {
                    requireArgs(rest, 1, "playlist <url|id>");
                    Playlist playlist = service.parsePlaylist(rest.get(0));
                    out.printf("%s (%d songs)%n", playlist.name(), playlist.songs().size());
                    for (Song song : playlist.songs()) {
                        out.printf("%s\t%s\t%s%n", song.id(), song.name(), song.artistLine());
                    }
                }
                case "probe" -> {
                    for (ProviderStatus status : service.probeProviders()) {
                        out.printf("%-16s %-5s %6d ms  %-9s %s%n", status.name(), status.available() ? "up" : "down",
                            status.latencyMs(), status.state(), status.message());
                    }
                }
                case "stats" -> {
                    Map<String, SourceStats.Counter> stats = service.sourceStats();
                    stats.forEach((name, counter) -> out.printf(Locale.ROOT, "%-16s %5d ok %5d failed  %.2f%n",
                        name, counter.success(), counter.failure(), counter.successRate()));
                    Path dir = config.statsFile().toAbsolutePath().getParent();
                    Path csv = new SourceStatsCsvExporter(dir).export(stats, "source-stats.csv");
                    out.println("Exported " + csv);
                }
                default -> {
                    out.println("Unknown mode: " + mode);
                    out.print(USAGE);
                    out.println();
                    return 2;
                }
            }
            return 0;
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 2;
        } catch (MusicResolutionException e) {
            logger.error("{} failed ({}): {}", mode, e.getKind(), e.getMessage());
            out.println(e.getUserMessage());
            return 1;
        } catch (IOException e) {
            logger.error("{} failed: {}", mode, e.getMessage());
            out.println("Failed to write output: " + e.getMessage());
            return 1;
        }
    }

    private static String[] promptForCommand(BufferedReader in) {
        try {
            String input = in.readLine();
            if (input != null && !input.isBlank()) {
                return input.trim().split("\\s+");
            }
        } catch (IOException e) {
            logger.warn("Failed to read mode from standard input: {}", e.getMessage());
        }
        return new String[]{"probe"};
    }

    private static void requireArgs(List<String> args, int count, String usage) {
        if (args.size() < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }
}
