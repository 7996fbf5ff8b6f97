package org.gridsnake.cli.commands;

import org.gridsnake.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the simulate subcommand end to end through picocli with the default configuration.
 */
@Tag("integration")
class SimulateCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private List<String> outputLines() {
        return Arrays.asList(out.toString().split("\\R"));
    }

    @Test
    void singleTick_movesSnakeUp() {
        int exitCode = execute("simulate", "--ticks", "1", "--no-food");

        assertThat(exitCode).isZero();
        List<String> lines = outputLines();
        // border, rows y = 9 .. 0, border, status
        assertThat(lines).hasSize(13);
        assertThat(lines.get(0)).isEqualTo("############");
        assertThat(lines.get(1 + (9 - 4))).isEqualTo("#...@......#");
        assertThat(lines.get(1 + (9 - 3))).isEqualTo("#...o......#");
        assertThat(lines.get(12)).isEqualTo("length:2 tick:1 resets:0 heading:UP food:0");
    }

    @Test
    void scriptedTurn_changesHeading() {
        int exitCode = execute("simulate", "--ticks", "3", "--moves", ".R.", "--no-food");

        assertThat(exitCode).isZero();
        List<String> lines = outputLines();
        // (3,3) -> (3,4) -> (4,4) -> (5,4)
        assertThat(lines.get(1 + (9 - 4))).isEqualTo("#....o@....#");
        assertThat(lines.get(12)).isEqualTo("length:2 tick:3 resets:0 heading:RIGHT food:0");
    }

    @Test
    void runningIntoWall_resetsSnake() {
        int exitCode = execute("simulate", "--ticks", "7", "--no-food");

        assertThat(exitCode).isZero();
        // heading UP from (3,3), the seventh tick leaves the arena at y = 10
        assertThat(outputLines().get(12)).isEqualTo("length:2 tick:7 resets:1 heading:UP food:0");
    }

    @Test
    void sameSeed_sameBoard() {
        execute("simulate", "--ticks", "40", "--seed", "9", "--moves", "..RR..DD..LL");
        String first = out.toString();
        out.getBuffer().setLength(0);

        execute("simulate", "--ticks", "40", "--seed", "9", "--moves", "..RR..DD..LL");

        assertThat(out.toString()).isEqualTo(first);
    }

    @Test
    void everyTick_printsOneBoardPerTick() {
        execute("simulate", "--ticks", "2", "--no-food", "--every-tick");

        assertThat(outputLines()).hasSize(26);
        assertThat(outputLines().get(25)).isEqualTo("length:2 tick:2 resets:0 heading:UP food:0");
    }

    @Test
    void invalidMove_failsWithUsageError() {
        int exitCode = execute("simulate", "--ticks", "2", "--moves", "X");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Invalid move 'X'");
    }

    @Test
    void configFile_shapesTheArena(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("small.conf");
        Files.writeString(file, "gridsnake.arena { width = 5, height = 6 }\n", StandardCharsets.UTF_8);

        int exitCode = execute("--config", file.toString(), "simulate", "--ticks", "0", "--no-food");

        assertThat(exitCode).isZero();
        assertThat(outputLines()).hasSize(9);
        assertThat(outputLines().get(0)).isEqualTo("#######");
    }

    @Test
    void invalidGameSettings_exitWithFailure(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.conf");
        Files.writeString(file, "gridsnake.arena.width = 0\n", StandardCharsets.UTF_8);

        assertThat(execute("--config", file.toString(), "simulate", "--ticks", "1")).isEqualTo(1);
    }

    @Test
    void missingConfigFile_exitsWithFailure(@TempDir Path dir) {
        assertThat(execute("--config", dir.resolve("nope.conf").toString(), "simulate")).isEqualTo(1);
    }
}
