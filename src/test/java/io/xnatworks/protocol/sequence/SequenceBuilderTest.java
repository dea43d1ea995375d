/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.protocol.sequence;

import io.xnatworks.protocol.parameter.Parameter;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ParameterValue;
import io.xnatworks.protocol.parameter.ValueKind;
import org.junit.jupiter.api.*;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SequenceBuilder and ImagingSequence.
 */
@DisplayName("Imaging Sequence Tests")
class SequenceBuilderTest {

    private static Map<String, Object> t1Header() {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("ProtocolName", "t1_mprage_sag");
        header.put("(0018,0080)", "2300");
        header.put("EchoTime", 2.98);
        header.put("FlipAngle", 9);
        header.put("InPlanePhaseEncodingDirection", "ROW");
        header.put("PixelBandwidth", 240);
        header.put("Accel. mode", "GRAPPA");
        return header;
    }

    @Nested
    @DisplayName("Header Construction Tests")
    class HeaderTests {

        @Test
        @DisplayName("Should build a sequence from a header mapping")
        void shouldBuildFromHeader() {
            ImagingSequence seq = ImagingSequence.fromHeader(t1Header());

            assertEquals("t1_mprage_sag", seq.getName());
            assertFalse(seq.isUnnamed());
            assertEquals(2300.0, seq.getParameter("RepetitionTime").getValue().getNumber());
            assertArrayEquals(new double[]{2.98}, seq.getParameter("TE").getValue().getVector());
            assertEquals("ROW", seq.getParameter("PhaseEncodingDirection").getValue().asText());
            assertTrue(seq.isFullySpecified());
            assertTrue(seq.getSourceDescriptor().startsWith("header:sha256:"));
            assertEquals("header:sha256:".length() + 16, seq.getSourceDescriptor().length());
        }

        @Test
        @DisplayName("Should accept integer tag keys")
        void shouldAcceptIntegerTags() {
            Map<Object, Object> header = new LinkedHashMap<>();
            header.put(0x00180080, 2000);
            header.put(0x00181314, 90);
            ImagingSequence seq = SequenceBuilder.fromHeader(header, "epi", ParameterRegistry.getDefault());

            assertEquals(2000.0, seq.getParameter(0x00180080).getValue().getNumber());
            assertEquals(90.0, seq.getParameter("FlipAngle").getValue().getNumber());
        }

        @Test
        @DisplayName("Should keep unknown fields without failing the build")
        void shouldTolerateUnrecognizedFields() {
            Map<String, Object> header = t1Header();
            header.put("VendorSpecificBlob123", "0xDEADBEEF");
            ImagingSequence seq = ImagingSequence.fromHeader(header);

            Parameter blob = seq.getParameter("VendorSpecificBlob123");
            assertNotNull(blob);
            assertFalse(blob.isRecognized());
            assertEquals(ValueKind.RAW, blob.getValue().getKind());
            assertEquals(1, seq.getUnrecognizedParameters().size());
            assertEquals(7, seq.getRecognizedParameters().size());
        }

        @Test
        @DisplayName("Should keep a malformed value as raw without failing the build")
        void shouldTolerateCoercionFailure() {
            Map<String, Object> header = t1Header();
            header.put("FlipAngle", "steep");
            ImagingSequence seq = ImagingSequence.fromHeader(header);

            Parameter fa = seq.getParameter("FlipAngle");
            assertTrue(fa.isUncoerced());
            assertEquals("steep", fa.getValue().asText());
            assertEquals(2300.0, seq.getParameter("RepetitionTime").getValue().getNumber());
        }

        @Test
        @DisplayName("Should derive the same provenance for the same header")
        void shouldDigestDeterministically() {
            Map<String, Object> reversed = new LinkedHashMap<>();
            Object[] keys = t1Header().keySet().toArray();
            for (int i = keys.length - 1; i >= 0; i--) {
                reversed.put((String) keys[i], t1Header().get(keys[i]));
            }
            assertEquals(SequenceBuilder.headerDigest(t1Header()), SequenceBuilder.headerDigest(reversed));

            Map<String, Object> changed = t1Header();
            changed.put("FlipAngle", 10);
            assertNotEquals(SequenceBuilder.headerDigest(t1Header()), SequenceBuilder.headerDigest(changed));
        }

        @Test
        @DisplayName("Should derive effective echo spacing from bandwidth and phase steps")
        void shouldDeriveEffectiveEchoSpacing() {
            Map<String, Object> header = t1Header();
            header.put("PixelBandwidth", 2000);
            header.put("PhaseEncodingSteps", 100);
            ImagingSequence seq = ImagingSequence.fromHeader(header);

            Parameter ees = seq.getParameter("EffectiveEchoSpacing");
            assertNotNull(ees);
            assertEquals(5e-6, ees.getValue().getNumber(), 1e-12);
            assertEquals("s", ees.getUnit());

            assertFalse(ImagingSequence.fromHeader(t1Header()).hasParameter("EffectiveEchoSpacing"));
        }
    }

    @Nested
    @DisplayName("Dictionary Construction Tests")
    class DictTests {

        @Test
        @DisplayName("Should mark dictionary sequences as manual")
        void shouldMarkManualSource() {
            ImagingSequence seq = ImagingSequence.fromDict("t1w", Collections.singletonMap("RepetitionTime", 2000));
            assertEquals("t1w", seq.getName());
            assertEquals(SequenceBuilder.MANUAL_SOURCE, seq.getSourceDescriptor());
            assertFalse(seq.hasParameter("EffectiveEchoSpacing"));
        }

        @Test
        @DisplayName("Should report missing required parameters")
        void shouldReportMissingRequired() {
            ImagingSequence seq = ImagingSequence.fromDict("t1w", Collections.singletonMap("RepetitionTime", 2000));
            assertFalse(seq.isFullySpecified());
            assertEquals(Arrays.asList("ParallelAcquisitionTechnique", "PhaseEncodingDirection", "EchoTime",
                    "FlipAngle", "PixelBandwidth"), seq.getMissingRequired());
        }

        @Test
        @DisplayName("Should keep the first value when two keys resolve to one name")
        void shouldKeepFirstDuplicate() {
            ImagingSequence seq = new SequenceBuilder()
                    .put("TR", 2000)
                    .put("RepetitionTime", 3000)
                    .put("0018,0080", 4000)
                    .build();
            assertEquals(2000.0, seq.getParameter("RepetitionTime").getValue().getNumber());
            assertEquals(1, seq.size());
        }

        @Test
        @DisplayName("Should skip null and blank values")
        void shouldSkipBlankValues() {
            Map<String, Object> dict = new LinkedHashMap<>();
            dict.put("RepetitionTime", null);
            dict.put("EchoTime", "  ");
            dict.put("FlipAngle", 90);
            ImagingSequence seq = ImagingSequence.fromDict("x", dict);
            assertEquals(1, seq.size());
            assertFalse(seq.hasParameter("RepetitionTime"));
        }

        @Test
        @DisplayName("Should detect multi-echo sequences")
        void shouldDetectMultiEcho() {
            assertTrue(ImagingSequence.fromDict("me", Collections.singletonMap("EchoTime", new double[]{2.1, 4.2, 6.3})).isMultiEcho());
            assertFalse(ImagingSequence.fromDict("se", Collections.singletonMap("EchoTime", 30)).isMultiEcho());
        }

        @Test
        @DisplayName("Should keep parameters in insertion order")
        void shouldKeepInsertionOrder() {
            ImagingSequence seq = new SequenceBuilder()
                    .put("FlipAngle", 9)
                    .put("Unknown", "x")
                    .put("TR", 2000)
                    .build();
            assertEquals(Arrays.asList("FlipAngle", "Unknown", "RepetitionTime"),
                    Arrays.asList(seq.getParameters().keySet().toArray()));
        }
    }

    @Nested
    @DisplayName("Naming Tests")
    class NamingTests {

        @Test
        @DisplayName("Should prefer the explicit name")
        void shouldPreferExplicitName() {
            assertEquals("mine", ImagingSequence.fromHeader(t1Header(), "mine").getName());
        }

        @Test
        @DisplayName("Should fall back to series description")
        void shouldFallBackToSeriesDescription() {
            Map<String, Object> header = new LinkedHashMap<>();
            header.put("ProtocolName", " ");
            header.put("SeriesDescription", "T2 FLAIR");
            assertEquals("T2 FLAIR", ImagingSequence.fromHeader(header).getName());
        }

        @Test
        @DisplayName("Should flag sequences without a derivable name")
        void shouldFlagUnnamed() {
            ImagingSequence seq = ImagingSequence.fromDict(Collections.singletonMap("RepetitionTime", 2000));
            assertTrue(seq.isUnnamed());
            assertEquals(ImagingSequence.UNNAMED, seq.getName());

            ImagingSequence named = seq.renamed("t1w");
            assertNotSame(seq, named);
            assertEquals("t1w", named.getName());
            assertFalse(named.isUnnamed());
            assertTrue(seq.isUnnamed());
            assertEquals(seq.getParameters(), named.getParameters());
            assertThrows(IllegalArgumentException.class, () -> seq.renamed(" "));
        }
    }

    @Nested
    @DisplayName("Session Info Tests")
    class SessionInfoTests {

        private Map<String, Object> sessionHeader() {
            Map<String, Object> header = t1Header();
            header.put("(0010,0020)", "sub-0042");
            header.put("(0020,000D)", "1.2.840.113619.2.1");
            header.put("SeriesInstanceUID", "1.2.840.113619.2.1.7");
            header.put("ContentDate", "20240115");
            header.put("ContentTime", "134502.250000");
            return header;
        }

        @Test
        @DisplayName("Should read subject, session and run identifiers")
        void shouldReadIdentifiers() {
            ImagingSequence seq = ImagingSequence.fromHeader(sessionHeader());

            assertEquals("sub-0042", seq.getSubjectId().get());
            assertEquals("1.2.840.113619.2.1", seq.getSessionId().get());
            assertEquals("1.2.840.113619.2.1.7", seq.getRunId().get());
        }

        @Test
        @DisplayName("Should combine content date and time into a timestamp")
        void shouldReadTimestamp() {
            ImagingSequence seq = ImagingSequence.fromHeader(sessionHeader());

            assertEquals(LocalDateTime.of(2024, 1, 15, 13, 45, 2, 250_000_000), seq.getTimestamp().get());
            assertEquals("01_15_2024_13_45_02", seq.getTimestampLabel().get());
        }

        @Test
        @DisplayName("Should use the start of the day without a content time")
        void shouldReadDateOnly() {
            Map<String, Object> header = sessionHeader();
            header.remove("ContentTime");
            ImagingSequence seq = ImagingSequence.fromHeader(header);

            assertEquals(LocalDateTime.of(2024, 1, 15, 0, 0), seq.getTimestamp().get());
            assertEquals("01_15_2024", seq.getTimestampLabel().get());
        }

        @Test
        @DisplayName("Should accept shortened DICOM times")
        void shouldReadShortTime() {
            Map<String, Object> header = sessionHeader();
            header.put("ContentTime", "0930");
            assertEquals(LocalDateTime.of(2024, 1, 15, 9, 30), ImagingSequence.fromHeader(header).getTimestamp().get());
        }

        @Test
        @DisplayName("Should report nothing when the session fields are missing or unreadable")
        void shouldHandleMissingFields() {
            ImagingSequence bare = ImagingSequence.fromHeader(t1Header());
            assertFalse(bare.getSubjectId().isPresent());
            assertFalse(bare.getSessionId().isPresent());
            assertFalse(bare.getRunId().isPresent());
            assertFalse(bare.getTimestamp().isPresent());
            assertFalse(bare.getTimestampLabel().isPresent());

            Map<String, Object> header = sessionHeader();
            header.put("ContentDate", "2024-13-45");
            assertFalse(ImagingSequence.fromHeader(header).getTimestamp().isPresent());
        }
    }

    @Test
    @DisplayName("Should not allow parameters to be modified")
    void shouldBeImmutable() {
        ImagingSequence seq = ImagingSequence.fromHeader(t1Header());
        assertThrows(UnsupportedOperationException.class,
                () -> seq.getParameters().put("X", Parameter.recognized("X", ParameterValue.ofNumber(1), null)));
    }
}
