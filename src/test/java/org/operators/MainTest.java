package org.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main Tests")
class MainTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        @Test
        @DisplayName("Should fail without arguments")
        void testNoArguments() {
            assertEquals(Main.EXIT_ERROR, Main.run(new String[0]));
        }

        @Test
        @DisplayName("Should succeed when only help is requested")
        void testHelp() {
            assertEquals(Main.EXIT_OK, Main.run(new String[]{"-h"}));
        }

        @Test
        @DisplayName("Should reject unknown parameters and unknown bases")
        void testInvalidParameters() {
            assertEquals(Main.EXIT_ERROR, Main.run(new String[]{"-e", "p", "-x"}));
            assertEquals(Main.EXIT_ERROR, Main.run(new String[]{"-e", "p", "-b=xor"}));
        }

        @Test
        @DisplayName("Should reject combined input modes")
        void testExclusiveModes() throws IOException {
            Path file = Files.writeString(tempDir.resolve("f.txt"), "p\n");
            assertEquals(Main.EXIT_ERROR, Main.run(new String[]{"-e", "p", "-f", file.toString()}));
        }

        @Test
        @DisplayName("Should reject a missing input file")
        void testMissingFile() {
            assertEquals(Main.EXIT_ERROR, Main.run(new String[]{"-f", tempDir.resolve("none.txt").toString()}));
        }
    }

    @Nested
    @DisplayName("Expression mode")
    class ExpressionMode {

        @Test
        @DisplayName("Should reduce and verify a single formula")
        void testExpression() {
            assertEquals(Main.EXIT_OK, Main.run(new String[]{"-e", "(p <-> q) -| T", "-verify"}));
        }

        @Test
        @DisplayName("Should fail on a malformed formula")
        void testMalformedExpression() {
            assertEquals(Main.EXIT_ERROR, Main.run(new String[]{"-e", "p &"}));
        }
    }

    @Nested
    @DisplayName("File mode")
    class FileMode {

        @Test
        @DisplayName("Should write one result file per selected basis")
        void testFileOutputs() throws IOException {
            Path input = Files.write(tempDir.resolve("formule.txt"),
                    List.of("# esempi", "p -> q", "", "p + q"));
            Path output = tempDir.resolve("out");

            int exitCode = Main.run(new String[]{
                    "-f", input.toString(), "-o", output.toString(), "-b=nao,nand", "-verify"});

            assertEquals(Main.EXIT_OK, exitCode);
            assertEquals(List.of("(~p | q)", "((p & ~q) | (~p & q))"),
                    Files.readAllLines(output.resolve("formule_NOT_AND_OR.txt")));
            assertEquals(2, Files.readAllLines(output.resolve("formule_NAND.txt")).size());
            assertFalse(Files.exists(output.resolve("formule_IMPLIES_NOT.txt")));
        }

        @Test
        @DisplayName("Should skip malformed lines and report the failure")
        void testMalformedLine() throws IOException {
            Path input = Files.write(tempDir.resolve("misto.txt"), List.of("~p", "p $ q", "T"));

            int exitCode = Main.run(new String[]{"-f", input.toString(), "-b=if"});

            assertEquals(Main.EXIT_ERROR, exitCode);
            assertEquals(List.of("(p -> F)", "(F -> F)"),
                    Files.readAllLines(tempDir.resolve("misto_IMPLIES_FALSE.txt")));
        }
    }

    @Nested
    @DisplayName("Directory mode")
    class DirectoryMode {

        @Test
        @DisplayName("Should process every formula file and ignore previous results")
        void testDirectory() throws IOException {
            Files.write(tempDir.resolve("a.txt"), List.of("p & q"));
            Files.write(tempDir.resolve("b.txt"), List.of("p | q"));
            Files.write(tempDir.resolve("vecchio_NAND.txt"), List.of("non una formula"));

            int exitCode = Main.run(new String[]{"-d", tempDir.toString(), "-b=in", "-verify"});

            assertEquals(Main.EXIT_OK, exitCode);
            assertEquals(List.of("~(p -> ~q)"), Files.readAllLines(tempDir.resolve("a_IMPLIES_NOT.txt")));
            assertEquals(List.of("(~p -> q)"), Files.readAllLines(tempDir.resolve("b_IMPLIES_NOT.txt")));
        }
    }
}
