package net.atndebug.debug;

import java.util.ArrayList;
import java.util.List;
import org.json.JSONObject;
import org.junit.Test;

import static org.junit.Assert.*;

public class EventQueueTest {

    private static class Recorder extends DebuggerAdapter {

        final List<String> seen = new ArrayList<String>();

        public void onEnd() {
            seen.add("end");
        }

        public void onStopOnStep() {
            seen.add("step");
        }

        public void onBreakpointValidated(BreakPoint breakPoint) {
            seen.add("bp" + breakPoint.getId());
        }

        public void onOutput(String message, String source, int line,
                             int column, boolean isError) {
            seen.add(message + "@" + line + ":" + column + (isError ? "!" :
                                                                      ""));
        }

    }

    @Test
    public void testDeliveryOrder() {
        EventQueue queue = new EventQueue();
        Recorder rec = new Recorder();
        queue.addListener(rec);
        queue.post(DebuggerEvent.stopOnStep());
        queue.post(DebuggerEvent.output("hello", "T.g4", 3, 4, true));
        queue.post(DebuggerEvent.breakpointValidated(
            new BreakPoint(7, "T.g4", 1)));
        queue.post(DebuggerEvent.end());
        assertFalse(queue.isEmpty());
        assertEquals(4, queue.peekEvents().size());
        assertTrue(rec.seen.isEmpty());

        assertEquals(4, queue.deliverEvents());
        assertEquals("[step, hello@3:4!, bp7, end]", rec.seen.toString());
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.deliverEvents());
    }

    @Test
    public void testFailingListener() {
        EventQueue queue = new EventQueue();
        Recorder rec = new Recorder();
        queue.addListener(new DebuggerAdapter() {
            public void onEnd() {
                throw new IllegalStateException("Listener failure");
            }
        });
        queue.addListener(rec);
        queue.post(DebuggerEvent.end());
        queue.post(DebuggerEvent.stopOnStep());
        assertEquals(2, queue.deliverEvents());
        assertEquals("[end, step]", rec.seen.toString());
    }

    @Test
    public void testEventsPostedDuringDelivery() {
        final EventQueue queue = new EventQueue();
        Recorder rec = new Recorder();
        queue.addListener(new DebuggerAdapter() {
            public void onStopOnStep() {
                queue.post(DebuggerEvent.end());
            }
        });
        queue.addListener(rec);
        queue.post(DebuggerEvent.stopOnStep());
        assertEquals(1, queue.deliverEvents());
        assertEquals("[step]", rec.seen.toString());
        assertEquals(1, queue.deliverEvents());
        assertEquals("[step, end]", rec.seen.toString());
    }

    @Test
    public void testDrainAndRemove() {
        EventQueue queue = new EventQueue();
        Recorder rec = new Recorder();
        queue.addListener(rec);
        queue.removeListener(rec);
        queue.post(DebuggerEvent.end());
        List<DebuggerEvent> drained = queue.drainEvents();
        assertEquals(1, drained.size());
        assertEquals(DebuggerEvent.Type.END, drained.get(0).getType());
        assertTrue(drained.get(0).getType().isStop());
        assertEquals(0, queue.deliverEvents());
        assertTrue(rec.seen.isEmpty());
    }

    @Test(expected = NullPointerException.class)
    public void testPostNull() {
        new EventQueue().post(null);
    }

    @Test
    public void testJSON() {
        JSONObject out = DebuggerEvent.output("oops", null, 1, 0, false)
            .toJSON();
        assertEquals("output", out.getString("event"));
        assertEquals("oops", out.getString("message"));
        assertTrue(out.isNull("source"));
        assertFalse(out.getBoolean("isError"));

        BreakPoint bp = new BreakPoint(2, "T.g4", 5);
        JSONObject validated = DebuggerEvent.breakpointValidated(bp)
            .toJSON();
        assertEquals("breakpointValidated", validated.getString("event"));
        JSONObject inner = validated.getJSONObject("breakpoint");
        assertEquals(2, inner.getInt("id"));
        assertEquals(5, inner.getInt("line"));
        assertFalse(inner.getBoolean("validated"));

        assertEquals("stopOnBreakpoint", DebuggerEvent.stopOnBreakpoint()
                     .toJSON().getString("event"));
        assertFalse(DebuggerEvent.Type.BREAKPOINT_VALIDATED.isStop());
    }

}
