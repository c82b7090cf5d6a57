package com.ledgerlens.backend.services.statements.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.services.statements.model.RawFrame;

class FrameSamplerTest {

    private final FrameSampler sampler = new FrameSampler(ImportProperties.defaults());

    private static RawFrame numbered(int rows) {
        List<Object> ids = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            ids.add(i);
        }
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("id", ids);
        return RawFrame.of(cols);
    }

    @Test
    void smallFrame_isReturnedWhole() {
        RawFrame frame = numbered(30);

        assertSame(frame, sampler.sample(frame));
    }

    @Test
    void largeFrame_takesHeadMiddleSliceAndTail() {
        RawFrame sample = sampler.sample(numbered(1000));
        List<Object> ids = sample.column("id");

        assertEquals(45, ids.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, ids.get(i));
            assertEquals(980 + i, ids.get(25 + i));
        }
        int middleStart = (Integer) ids.get(20);
        assertTrue(middleStart >= 20 && middleStart + 5 <= 980, "middle slice stays inside the middle");
        for (int i = 1; i < 5; i++) {
            assertEquals(middleStart + i, ids.get(20 + i));
        }
    }

    @Test
    void sampling_isDeterministic() {
        RawFrame frame = numbered(500);

        assertEquals(sampler.sample(frame).column("id"), sampler.sample(frame).column("id"));
    }
}
