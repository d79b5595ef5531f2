package com.cycleindicators.common.config;

import com.cycleindicators.common.exception.IndicatorConfigurationException;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.Side;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorConfigurationLoaderTest {

    private final IndicatorConfigurationLoader loader = new IndicatorConfigurationLoader(new ObjectMapper());

    private IndicatorConfiguration loadString(String json) {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Nested
    @DisplayName("load(): well-formed file")
    class WellFormed {

        private IndicatorConfiguration loadResource() throws Exception {
            try (InputStream in = getClass().getResourceAsStream("/indicator-config-test.json")) {
                assertNotNull(in, "test resource missing");
                return loader.load(in, "indicator-config-test.json");
            }
        }

        @Test
        @DisplayName("both sides parsed in file order")
        void parsesBothSides() throws Exception {
            IndicatorConfiguration config = loadResource();

            assertEquals(4, config.size());
            assertEquals(List.of("alpha", "beta", "flat"),
                config.specs(Side.BOTTOM).stream().map(IndicatorSpec::name).toList());
            assertEquals(Bounds.of(0, 100), config.bounds(Side.TOP, "gamma").orElseThrow());
            assertEquals(12.0, config.weight(Side.TOP, "gamma").orElseThrow());
        }

        @Test
        @DisplayName("degenerate bounds are accepted")
        void degenerateAccepted() throws Exception {
            assertTrue(loadResource().bounds(Side.BOTTOM, "flat").orElseThrow().isDegenerate());
        }

        @Test
        @DisplayName("lookups are side-scoped")
        void sideScoped() throws Exception {
            IndicatorConfiguration config = loadResource();
            assertTrue(config.spec(Side.TOP, "alpha").isEmpty());
            assertTrue(config.spec(Side.BOTTOM, "alpha").isPresent());
        }
    }

    @Nested
    @DisplayName("load(): rejected input")
    class Rejected {

        @Test
        void negativeWeight() {
            assertThrows(IndicatorConfigurationException.class, () ->
                loadString("{\"bottom\":{\"x\":{\"lower\":0,\"upper\":1,\"weight\":-1}}}"));
        }

        @Test
        void invertedBounds() {
            assertThrows(IndicatorConfigurationException.class, () ->
                loadString("{\"top\":{\"x\":{\"lower\":5,\"upper\":1,\"weight\":1}}}"));
        }

        @Test
        void missingField() {
            assertThrows(IndicatorConfigurationException.class, () ->
                loadString("{\"top\":{\"x\":{\"lower\":0,\"weight\":1}}}"));
        }

        @Test
        void nonNumericField() {
            assertThrows(IndicatorConfigurationException.class, () ->
                loadString("{\"top\":{\"x\":{\"lower\":0,\"upper\":\"ten\",\"weight\":1}}}"));
        }

        @Test
        void unknownSide() {
            assertThrows(IndicatorConfigurationException.class, () ->
                loadString("{\"middle\":{\"x\":{\"lower\":0,\"upper\":1,\"weight\":1}}}"));
        }

        @Test
        void malformedJson() {
            assertThrows(IndicatorConfigurationException.class, () -> loadString("{not json"));
        }

        @Test
        void notAnObject() {
            assertThrows(IndicatorConfigurationException.class, () -> loadString("[1,2,3]"));
        }
    }

    @Test
    @DisplayName("duplicate name within one side is rejected")
    void duplicateRejected() {
        IndicatorSpec a = new IndicatorSpec("x", Side.TOP, Bounds.of(0, 1), 1);
        IndicatorSpec b = new IndicatorSpec("x", Side.TOP, Bounds.of(0, 2), 2);
        assertThrows(IndicatorConfigurationException.class, () -> IndicatorConfiguration.of(List.of(a, b)));
    }

    @Test
    @DisplayName("same name on different sides is allowed")
    void sameNameAcrossSides() {
        IndicatorConfiguration config = IndicatorConfiguration.of(List.of(
            new IndicatorSpec("x", Side.TOP, Bounds.of(0, 1), 1),
            new IndicatorSpec("x", Side.BOTTOM, Bounds.of(0, 2), 2)));
        assertEquals(2, config.size());
    }
}
