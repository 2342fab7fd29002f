package com.firm.provenance.util;

import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.DuplicateTreeException;
import com.firm.provenance.testing.RecordingBuildListener;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CompositeBuildListenerTest {

    @Test
    public void testFansOutInOrder() {
        RecordingBuildListener a = new RecordingBuildListener();
        RecordingBuildListener b = new RecordingBuildListener();
        CompositeBuildListener composite = new CompositeBuildListener(a);
        composite.add(b);

        composite.onBuildStarted("t");
        composite.onNodeInserted("t", DerivationNode.axiom("A", "a"));
        composite.onBuildValidated("t", 1, true);
        composite.onBuildRejected("u", new DuplicateTreeException("u"));

        List<String> expected = List.of("started:t", "inserted:t:A", "validated:t:1:pure",
                "rejected:u:DuplicateTreeException");
        assertEquals(expected, a.events());
        assertEquals(expected, b.events());
    }

    @Test
    public void testEmptyCompositeIsHarmless() {
        CompositeBuildListener composite = new CompositeBuildListener();
        composite.onBuildStarted("t");
        composite.onBuildValidated("t", 0, false);
    }

    @Test
    public void testLoggingListenerAlongsideRecorder() {
        RecordingBuildListener rec = new RecordingBuildListener();
        CompositeBuildListener composite = new CompositeBuildListener(new LoggingBuildListener(), rec);

        composite.onBuildStarted("t");
        composite.onBuildValidated("t", 3, false);
        assertEquals(List.of("started:t", "validated:t:3:empirical"), rec.events());
    }
}
