package dev.nuclr.photo.viewer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class DefaultMemoryBudgetTest {

    @Test
    public void limitStaysWithinBounds() {
        int limit = new DefaultMemoryBudget().appMemoryLimitMb();

        assertTrue(limit >= 512 && limit <= 8192, "limit " + limit);
    }
}
