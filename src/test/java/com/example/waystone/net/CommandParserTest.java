package com.example.waystone.net;

import com.example.waystone.net.CommandParser.ParsedCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandParser Tests")
public class CommandParserTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    @DisplayName("parse returns null for blank input")
    void blankReturnsNull(String input) {
        assertNull(CommandParser.parse(input));
    }

    @Test
    @DisplayName("verb is lowercased, argument case is kept")
    void verbLowercased() {
        ParsedCommand c = CommandParser.parse("TELL Bob Hello There");
        assertEquals("tell", c.getVerb());
        assertEquals(List.of("Bob", "Hello", "There"), c.getArgs());
        assertEquals("Hello There", String.join(" ", c.getArgs().subList(1, 3)));
    }

    @Test
    @DisplayName("runs of whitespace separate arguments")
    void whitespaceRuns() {
        ParsedCommand c = CommandParser.parse("  say   hello    world  ");
        assertEquals("say", c.getVerb());
        assertEquals(List.of("hello", "world"), c.getArgs());
        assertEquals("hello world", c.getArgString());
        assertEquals("say   hello    world", c.getRawInput());
    }

    @Test
    @DisplayName("verb without arguments has an empty list")
    void noArgs() {
        ParsedCommand c = CommandParser.parse("look");
        assertEquals("look", c.getVerb());
        assertTrue(c.getArgs().isEmpty());
        assertEquals("", c.getArgString());
    }

    @Test
    @DisplayName("leading quote is shorthand for say with the rest as one argument")
    void quoteShorthand() {
        ParsedCommand c = CommandParser.parse("'Hello   there, friend");
        assertEquals("say", c.getVerb());
        assertEquals(List.of("Hello   there, friend"), c.getArgs());
    }

    @Test
    @DisplayName("leading colon is shorthand for emote")
    void colonShorthand() {
        ParsedCommand c = CommandParser.parse(":waves happily");
        assertEquals("emote", c.getVerb());
        assertEquals(List.of("waves happily"), c.getArgs());
    }

    @Test
    @DisplayName("a bare shorthand character has no arguments")
    void bareShorthand() {
        ParsedCommand c = CommandParser.parse("'");
        assertEquals("say", c.getVerb());
        assertTrue(c.getArgs().isEmpty());
    }
}
