package com.ledgerlens.backend.services.statements.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.services.statements.model.RawFrame;

import lombok.RequiredArgsConstructor;

/**
 * Picks the rows shown to the model: the first N, a contiguous slice from a seeded random
 * offset in the middle, and the last N. Small frames are returned whole.
 */
@Component
@RequiredArgsConstructor
public class FrameSampler {

    private static final long SEED = 42L;

    private final ImportProperties properties;

    public RawFrame sample(RawFrame frame) {
        return sample(frame, properties.sampleSize(), properties.middleSampleSize());
    }

    public RawFrame sample(RawFrame frame, int edgeRows, int middleRows) {
        int n = frame.rowCount();
        if (n <= 2 * edgeRows + middleRows) {
            return frame;
        }

        List<Integer> indices = new ArrayList<>(2 * edgeRows + middleRows);
        for (int i = 0; i < edgeRows; i++) {
            indices.add(i);
        }

        int span = n - 2 * edgeRows;
        int offset = edgeRows + new Random(SEED + n).nextInt(span - middleRows + 1);
        for (int i = 0; i < middleRows; i++) {
            indices.add(offset + i);
        }

        for (int i = n - edgeRows; i < n; i++) {
            indices.add(i);
        }
        return frame.selectRows(indices);
    }
}
