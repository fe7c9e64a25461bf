package io.envkeeper.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void base_url_is_taken_from_the_front() {
        var parsed = Cli.parseBaseUrl(new String[]{"--base-url", "http://h:9000", "list", "--all"});
        assertEquals("http://h:9000", parsed.getKey());
        assertArrayEquals(new String[]{"list", "--all"}, parsed.getValue());

        var dflt = Cli.parseBaseUrl(new String[]{"get", "sess-1"});
        assertEquals("http://localhost:8080", dflt.getKey());
        assertEquals(2, dflt.getValue().length);
    }

    @Test
    void config_pairs_split_on_the_first_equals() {
        assertEquals(Map.of("kernel", "python3", "env", "A=B"),
                Cli.parseConfig(new String[]{"kernel=python3", "env=A=B"}));
        assertEquals(Map.of("k", ""), Cli.parseConfig(new String[]{"k="}));
        assertThrows(Cli.CliException.class, () -> Cli.parseConfig(new String[]{"=x"}));
        assertThrows(Cli.CliException.class, () -> Cli.parseConfig(new String[]{"novalue"}));
    }

    @Test
    void after_must_be_a_non_negative_number() {
        assertEquals(7, Cli.parseAfter("7"));
        assertThrows(Cli.CliException.class, () -> Cli.parseAfter("-1"));
        assertThrows(Cli.CliException.class, () -> Cli.parseAfter("seven"));
    }
}
