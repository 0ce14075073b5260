package webpilot.cli;

import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class ConsoleHumanInputTest {

    @Test(description = "The question is printed and the next line is the answer")
    public void testAsk() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsoleHumanInput human = new ConsoleHumanInput(
                new BufferedReader(new StringReader("  the signup form \n")),
                new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertThat(human.ask("What should I test?")).isEqualTo("the signup form");
        assertThat(bytes.toString(StandardCharsets.UTF_8)).contains("[Agent Question]: What should I test?");
    }

    @Test(description = "End of input answers with an empty string")
    public void testEof() {
        ConsoleHumanInput human = new ConsoleHumanInput(
                new BufferedReader(new StringReader("")), new PrintStream(new ByteArrayOutputStream()));

        assertThat(human.ask("Anything?")).isEmpty();
    }
}
