package com.herzen.maxviews;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.maxviews.availability.AvailabilityFormatException;
import com.herzen.maxviews.availability.AvailabilityModels.*;
import com.herzen.maxviews.availability.AvailabilityTreeParser;
import com.herzen.maxviews.config.MaxViewsProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AvailabilityTreeParserTest {
    private final AvailabilityTreeParser parser =
            new AvailabilityTreeParser(new ObjectMapper(), new MaxViewsProperties("maxviews", "r"));

    @Test
    void parsesStoredAvailability() {
        String json = """
                {"op":"&","c":[
                  {"type":"maxviews","viewslimit":5},
                  {"type":"date","d":">=","t":1700000000},
                  {"op":"|","c":[{"type":"maxviews","viewslimit":"2"}]}
                ],"showc":[true,true,true]}
                """;

        ConditionNode tree = parser.parse(json);

        Composite root = assertInstanceOf(Composite.class, tree);
        assertEquals("&", root.op());
        assertEquals(3, root.children().size());
        assertEquals(new ViewLimitCondition(5), root.children().get(0));
        assertEquals(new OtherCondition("date"), root.children().get(1));
        Composite inner = assertInstanceOf(Composite.class, root.children().get(2));
        assertEquals("|", inner.op());
        assertEquals(List.of(new ViewLimitCondition(2)), inner.children());
    }

    @Test
    void missingAvailabilityIsAnEmptyTree() {
        assertEquals(Composite.empty(), parser.parse(null));
        assertEquals(Composite.empty(), parser.parse("  "));
        assertEquals(Composite.empty(), parser.parse("null"));
    }

    @Test
    void rejectsMalformedAvailability() {
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"op\":\"&\",\"c\":["));
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"op\":\"&\",\"c\":{}}"));
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"op\":\"&\",\"c\":[{\"d\":\">=\"}]}"));
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"c\":[{\"type\":\"maxviews\"}]}"));
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"c\":[{\"type\":\"maxviews\",\"viewslimit\":\"many\"}]}"));
        assertThrows(AvailabilityFormatException.class, () -> parser.parse("{\"c\":[{\"type\":\"maxviews\",\"viewslimit\":-3}]}"));
    }

    @Test
    void rejectsLimitOutsideTheIntRange() {
        assertThrows(AvailabilityFormatException.class,
                () -> parser.parse("{\"c\":[{\"type\":\"maxviews\",\"viewslimit\":4294967298}]}"));
        assertThrows(AvailabilityFormatException.class,
                () -> parser.parse("{\"c\":[{\"type\":\"maxviews\",\"viewslimit\":\"4294967298\"}]}"));
        assertEquals(new Composite("&", List.of(new ViewLimitCondition(Integer.MAX_VALUE))),
                parser.parse("{\"c\":[{\"type\":\"maxviews\",\"viewslimit\":2147483647}]}"));
    }
}
