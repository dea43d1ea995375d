/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.protocol.imaging;

import io.xnatworks.protocol.sequence.ImagingSequence;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ImagingProtocol.
 */
@DisplayName("ImagingProtocol Tests")
class ImagingProtocolTest {

    private ImagingProtocol protocol;
    private ImagingSequence seq1;
    private ImagingSequence seq2;

    @BeforeEach
    void setUp() {
        protocol = new ImagingProtocol("ABCD");
        seq1 = ImagingSequence.fromDict("t1", Collections.singletonMap("RepetitionTime", 2000));
        seq2 = ImagingSequence.fromDict("t1", Collections.singletonMap("RepetitionTime", 2500));
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("Should return a sequence added under a name")
        void shouldReturnAddedSequence() throws ProtocolException {
            protocol.addSequence("t1w", seq1);

            ImagingSequence found = protocol.getSequence("t1w");
            assertEquals("t1w", found.getName());
            assertEquals(seq1.getParameters(), found.getParameters());
            assertTrue(protocol.containsSequence("t1w"));
            assertTrue(protocol.findSequence("t1w").isPresent());
        }

        @Test
        @DisplayName("Should fail with not-found for an unknown name")
        void shouldFailLookupMiss() throws ProtocolException {
            protocol.addSequence("t1w", seq1);

            SequenceNotFoundException e = assertThrows(SequenceNotFoundException.class,
                    () -> protocol.getSequence("t2w"));
            assertEquals("t2w", e.getSequenceName());
            assertEquals("ABCD", e.getProtocolName());
            assertFalse(protocol.findSequence("t2w").isPresent());
        }

        @Test
        @DisplayName("Should match names case-sensitively")
        void shouldBeCaseSensitive() throws ProtocolException {
            protocol.addSequence("t1w", seq1);
            assertThrows(SequenceNotFoundException.class, () -> protocol.getSequence("T1W"));
        }
    }

    @Nested
    @DisplayName("Insertion Tests")
    class InsertionTests {

        @Test
        @DisplayName("Should refuse a second sequence under the same name")
        void shouldRejectDuplicateName() throws ProtocolException {
            protocol.addSequence("t1w", seq1);

            DuplicateSequenceException e = assertThrows(DuplicateSequenceException.class,
                    () -> protocol.addSequence("t1w", seq2));

            assertEquals("t1w", e.getSequenceName());
            assertEquals(1, protocol.size());
            assertEquals(2000.0, protocol.getSequence("t1w").getParameter("RepetitionTime").getValue().getNumber());
        }

        @Test
        @DisplayName("Should store its own copy carrying the key as name")
        void shouldOwnStoredSequence() throws ProtocolException {
            protocol.addSequence("anat", seq1);

            assertNotSame(seq1, protocol.getSequence("anat"));
            assertEquals("t1", seq1.getName());
            assertEquals("anat", protocol.getSequence("anat").getName());
        }

        @Test
        @DisplayName("Should add a named sequence under its own name")
        void shouldUseOwnName() throws ProtocolException {
            protocol.addSequence(seq1);
            assertEquals(Collections.singletonList("t1"), protocol.getSequenceNames());
        }

        @Test
        @DisplayName("Should reject unnamed sequences without an explicit name")
        void shouldRejectUnnamed() throws ProtocolException {
            ImagingSequence unnamed = ImagingSequence.fromDict(Collections.singletonMap("FlipAngle", 9));
            assertThrows(IllegalArgumentException.class, () -> protocol.addSequence(unnamed));

            protocol.addSequence("loc", unnamed);
            assertFalse(protocol.getSequence("loc").isUnnamed());
        }

        @Test
        @DisplayName("Should keep insertion order")
        void shouldKeepInsertionOrder() throws ProtocolException {
            protocol.addSequence("c", seq1);
            protocol.addSequence("a", seq1);
            protocol.addSequence("b", seq1);
            assertEquals(Arrays.asList("c", "a", "b"), protocol.getSequenceNames());
        }
    }

    @Nested
    @DisplayName("Dictionary Tests")
    class DictionaryTests {

        @Test
        @DisplayName("Should add a sequence from a dictionary")
        void shouldAddFromDict() throws ProtocolException {
            ImagingSequence added = protocol.addSequenceFromDict("fmap", Collections.singletonMap("EchoTime", new double[]{4.92, 7.38}));

            assertEquals("fmap", added.getName());
            assertTrue(protocol.getSequence("fmap").isMultiEcho());
        }

        @Test
        @DisplayName("Should add several sequences from nested dictionaries")
        void shouldAddManyFromDict() throws ProtocolException {
            Map<String, Map<String, Object>> dicts = new LinkedHashMap<>();
            dicts.put("func-bold_task-rest", Collections.<String, Object>singletonMap("RepetitionTime", 800));
            dicts.put("anat-T1w", Collections.<String, Object>singletonMap("RepetitionTime", 2300));

            protocol.addSequencesFromDict(dicts);

            assertEquals(Arrays.asList("func-bold_task-rest", "anat-T1w"), protocol.getSequenceNames());
            assertEquals(800.0, protocol.getSequence("func-bold_task-rest")
                    .getParameter("RepetitionTime").getValue().getNumber());
        }

        @Test
        @DisplayName("Should add nothing when one of the names is taken")
        void shouldRejectBatchWithDuplicate() throws ProtocolException {
            protocol.addSequence("anat-T1w", seq1);
            Map<String, Map<String, Object>> dicts = new LinkedHashMap<>();
            dicts.put("func-bold", Collections.<String, Object>singletonMap("RepetitionTime", 800));
            dicts.put("anat-T1w", Collections.<String, Object>singletonMap("RepetitionTime", 2300));

            assertThrows(DuplicateSequenceException.class, () -> protocol.addSequencesFromDict(dicts));
            assertEquals(Collections.singletonList("anat-T1w"), protocol.getSequenceNames());
        }
    }

    @Test
    @DisplayName("Should reject a blank protocol name")
    void shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new ImagingProtocol(" "));
    }

    @Test
    @DisplayName("Should start empty")
    void shouldStartEmpty() {
        assertTrue(protocol.isEmpty());
        assertTrue(protocol.getParseIssues().isEmpty());
    }
}
