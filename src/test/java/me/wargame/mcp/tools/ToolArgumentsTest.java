package me.wargame.mcp.tools;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentsTest {

    @Test
    void stringsAreTrimmedAndBlankMeansAbsent() {
        ToolArguments arguments = new ToolArguments(Map.of("a", "  text ", "b", "   "));

        assertEquals("text", arguments.requiredString("a"));
        assertNull(arguments.optionalString("b"));
        assertThrows(IllegalArgumentException.class, () -> arguments.requiredString("b"));
    }

    @Test
    void nonStringValueIsRejected() {
        ToolArguments arguments = new ToolArguments(Map.of("a", 42));

        assertThrows(IllegalArgumentException.class, () -> arguments.optionalString("a"));
    }

    @Test
    void integersAcceptJsonNumberShapes() {
        ToolArguments arguments = new ToolArguments(Map.of(
                "int", 3,
                "long", 4L,
                "whole", 5.0,
                "text", " 6 ",
                "fraction", 2.5,
                "huge", Long.MAX_VALUE));

        assertEquals(3, arguments.integer("int", 0));
        assertEquals(4, arguments.integer("long", 0));
        assertEquals(5, arguments.integer("whole", 0));
        assertEquals(6, arguments.requiredInteger("text"));
        assertEquals(9, arguments.integer("absent", 9));
        assertThrows(IllegalArgumentException.class, () -> arguments.integer("fraction", 0));
        assertThrows(IllegalArgumentException.class, () -> arguments.integer("huge", 0));
        assertThrows(IllegalArgumentException.class, () -> arguments.requiredInteger("absent"));
    }

    @Test
    void numbersAcceptStrings() {
        ToolArguments arguments = new ToolArguments(Map.of("n", 0.25, "s", "0.5", "bad", "half"));

        assertEquals(0.25, arguments.number("n", 0));
        assertEquals(0.5, arguments.number("s", 0));
        assertEquals(0.1, arguments.number("absent", 0.1));
        assertThrows(IllegalArgumentException.class, () -> arguments.number("bad", 0));
    }

    @Test
    void stringListsAcceptArraysAndCommaSeparatedText() {
        ToolArguments arguments = new ToolArguments(Map.of(
                "array", List.of("a", " ", " b "),
                "csv", "x, y,,z",
                "mixed", List.of("a", 1)));

        assertEquals(List.of("a", "b"), arguments.stringList("array"));
        assertEquals(List.of("x", "y", "z"), arguments.stringList("csv"));
        assertNull(arguments.stringList("absent"));
        assertThrows(IllegalArgumentException.class, () -> arguments.stringList("mixed"));
    }

    @Test
    void correlationIdIsOptional() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("correlation_id", "cid-1");

        assertEquals("cid-1", new ToolArguments(parameters).correlationId());
        assertNull(new ToolArguments(null).correlationId());
        assertNull(new ToolArguments(Map.of("correlation_id", 7)).correlationId());
    }
}
