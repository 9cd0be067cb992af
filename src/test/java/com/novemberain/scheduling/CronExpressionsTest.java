package com.novemberain.scheduling;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CronExpressionsTest {

    @Test
    public void recognizesValidExpressions() {
        assertTrue(CronExpressions.isValid("0 0 12 ? * MON-FRI"));
        assertFalse(CronExpressions.isValid("0 0 25 * * ?"));
        assertFalse(CronExpressions.isValid(null));
    }

    @Test
    public void validationCarriesParserMessage() {
        try {
            CronExpressions.validate("0 0 25 * * ?");
            fail("hour 25 must be rejected");
        } catch (InvalidScheduleException e) {
            assertTrue(e.getMessage().startsWith("Invalid cron expression '0 0 25 * * ?'"));
        }
    }

    @Test
    public void describesEachField() throws Exception {
        String summary = CronExpressions.describe("0 30 9 ? * MON");

        assertTrue(summary, summary.contains("minutes: 30"));
        assertTrue(summary, summary.contains("hours: 9"));
    }
}
