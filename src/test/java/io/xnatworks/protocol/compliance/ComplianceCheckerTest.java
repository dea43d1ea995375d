/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.protocol.compliance;

import io.xnatworks.protocol.imaging.DuplicateSequenceException;
import io.xnatworks.protocol.imaging.ImagingProtocol;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.parameter.ParameterValue;
import io.xnatworks.protocol.sequence.ImagingSequence;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ComplianceChecker.
 */
@DisplayName("ComplianceChecker Tests")
class ComplianceCheckerTest {

    private final ComplianceChecker checker = new ComplianceChecker();

    private static Map<String, Object> fullDict() {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("RepetitionTime", 2000);
        dict.put("EchoTime", 30);
        dict.put("FlipAngle", 90);
        dict.put("PhaseEncodingDirection", "COL");
        dict.put("PixelBandwidth", 2232);
        dict.put("ParallelAcquisitionTechnique", "GRAPPA");
        dict.put("Manufacturer", "SIEMENS");
        return dict;
    }

    private static Map<String, Object> with(String key, Object value) {
        Map<String, Object> dict = fullDict();
        if (value == null) {
            dict.remove(key);
        } else {
            dict.put(key, value);
        }
        return dict;
    }

    @Nested
    @DisplayName("Sequence Comparison Tests")
    class SequenceComparisonTests {

        @Test
        @DisplayName("Should find sequences built from the same dictionary compliant")
        void shouldRoundTripDictionary() {
            ImagingSequence a = ImagingSequence.fromDict("bold", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("bold", fullDict());

            ComplianceResult result = checker.compare(a, b);

            assertTrue(result.isCompliant(), result.toString());
            assertTrue(result.getMismatches().isEmpty());
            assertEquals(6, result.getEvaluated().size());
        }

        @Test
        @DisplayName("Should report a required parameter missing on one side")
        void shouldReportMissingRepetitionTime() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("RepetitionTime", null));

            ComplianceResult result = checker.compare(a, b);

            assertFalse(result.isCompliant());
            assertEquals(1, result.getMismatches().size());
            ParameterMismatch mismatch = result.getMismatch("RepetitionTime");
            assertEquals(MismatchType.MISSING_IN_SECOND, mismatch.getType());
            assertEquals(ParameterValue.ofNumber(2000), mismatch.getValueA());
            assertTrue(mismatch.getValueB().isAbsent());

            assertEquals(MismatchType.MISSING_IN_FIRST, checker.compare(b, a).getMismatch("RepetitionTime").getType());
        }

        @Test
        @DisplayName("Should report a required parameter missing on both sides")
        void shouldReportMissingInBoth() {
            ImagingSequence a = ImagingSequence.fromDict("a", with("FlipAngle", null));
            ImagingSequence b = ImagingSequence.fromDict("b", with("FlipAngle", null));

            ComplianceResult result = checker.compare(a, b);

            assertFalse(result.isCompliant());
            assertEquals(MismatchType.MISSING_IN_BOTH, result.getMismatch("FlipAngle").getType());
        }

        @Test
        @DisplayName("Should skip optional-for-comparison parameters when absent")
        void shouldSkipOptionalParameters() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("ParallelAcquisitionTechnique", null));

            ComplianceResult result = checker.compare(a, b);

            assertTrue(result.isCompliant());
            assertEquals(Collections.singletonList("ParallelAcquisitionTechnique"), result.getSkipped());
        }

        @Test
        @DisplayName("Should apply numeric tolerance symmetrically")
        void shouldApplyToleranceSymmetrically() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence near = ImagingSequence.fromDict("b", with("PixelBandwidth", 2232.5));
            ImagingSequence far = ImagingSequence.fromDict("c", with("PixelBandwidth", 2240));

            assertTrue(checker.compare(a, near).isCompliant());
            assertTrue(checker.compare(near, a).isCompliant());
            assertFalse(checker.compare(a, far).isCompliant());
            assertFalse(checker.compare(far, a).isCompliant());
            assertEquals(MismatchType.NOT_EQUIVALENT, checker.compare(a, far).getMismatch("PixelBandwidth").getType());
        }

        @Test
        @DisplayName("Should accept equivalent encodings")
        void shouldAcceptEquivalentEncodings() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("PhaseEncodingDirection", "j-"));
            ImagingSequence c = ImagingSequence.fromDict("c", with("ParallelAcquisitionTechnique", "2"));

            assertTrue(checker.compare(a, b).isCompliant());
            assertTrue(checker.compare(a, c).isCompliant());
            assertFalse(checker.compare(a, ImagingSequence.fromDict("d", with("PhaseEncodingDirection", "ROW"))).isCompliant());
        }

        @Test
        @DisplayName("Should report a reversed phase encoding polarity")
        void shouldReportReversedPolarity() {
            ImagingSequence positive = ImagingSequence.fromDict("a", with("PhaseEncodingDirection", "j"));
            ImagingSequence negative = ImagingSequence.fromDict("b", with("PhaseEncodingDirection", "j-"));

            ComplianceResult result = checker.compare(positive, negative);

            assertFalse(result.isCompliant());
            assertEquals(MismatchType.NOT_EQUIVALENT, result.getMismatch("PhaseEncodingDirection").getType());
            assertEquals(1, result.getMismatches().size());
            assertFalse(checker.compare(negative, positive).isCompliant());
        }

        @Test
        @DisplayName("Should report uncoerced values that differ")
        void shouldReportUncoercedValues() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("FlipAngle", "ninety"));

            ComplianceResult result = checker.compare(a, b);

            assertEquals(MismatchType.UNCOERCED, result.getMismatch("FlipAngle").getType());
        }

        @Test
        @DisplayName("Should never find identical uncoerced numbers compliant")
        void shouldReportIdenticalUncoercedNumbers() {
            Map<String, Object> dict = fullDict();
            dict.put("RepetitionTime", "NaN");
            dict.put("EchoTime", "n/a");

            ComplianceResult result = checker.compare(
                    ImagingSequence.fromDict("a", dict), ImagingSequence.fromDict("b", dict));

            assertFalse(result.isCompliant());
            assertEquals(MismatchType.UNCOERCED, result.getMismatch("RepetitionTime").getType());
            assertEquals(MismatchType.UNCOERCED, result.getMismatch("EchoTime").getType());
            assertFalse(checker.compare(ImagingSequence.fromDict("c", with("FlipAngle", "ninety")),
                    ImagingSequence.fromDict("d", with("FlipAngle", "ninety"))).isCompliant());
        }

        @Test
        @DisplayName("Should order mismatches by the registry")
        void shouldOrderMismatchesByRegistry() {
            Map<String, Object> other = new LinkedHashMap<>();
            other.put("PixelBandwidth", 100);
            other.put("FlipAngle", 10);
            other.put("RepetitionTime", 500);
            other.put("EchoTime", 5);
            other.put("PhaseEncodingDirection", "ROW");

            ComplianceResult result = checker.compare(
                    ImagingSequence.fromDict("a", fullDict()), ImagingSequence.fromDict("b", other));

            assertEquals(Arrays.asList("PhaseEncodingDirection", "EchoTime", "RepetitionTime", "FlipAngle", "PixelBandwidth"),
                    Arrays.asList(result.getMismatches().stream().map(ParameterMismatch::getName).toArray()));
            assertEquals(result.getMismatches(), checker.compare(
                    ImagingSequence.fromDict("a", fullDict()), ImagingSequence.fromDict("b", other)).getMismatches());
        }
    }

    @Nested
    @DisplayName("Extra Parameter Tests")
    class ExtraParameterTests {

        @Test
        @DisplayName("Should leave unrecognized fields out of the verdict")
        void shouldIgnoreUnrecognizedFields() {
            ImagingSequence a = ImagingSequence.fromDict("a", with("VendorSpecificBlob123", "one"));
            ImagingSequence b = ImagingSequence.fromDict("b", with("VendorSpecificBlob123", "two"));

            ComplianceResult result = checker.compare(a, b);

            assertTrue(result.isCompliant());
            assertFalse(result.getEvaluated().contains("VendorSpecificBlob123"));
        }

        @Test
        @DisplayName("Should compare requested unrecognized fields by raw equality")
        void shouldCompareUnrecognizedExtrasByRawText() {
            ImagingSequence a = ImagingSequence.fromDict("a", with("VendorSpecificBlob123", "one"));
            ImagingSequence b = ImagingSequence.fromDict("b", with("VendorSpecificBlob123", "one"));
            ImagingSequence c = ImagingSequence.fromDict("c", with("VendorSpecificBlob123", "ONE"));
            List<String> extras = Collections.singletonList("VendorSpecificBlob123");

            assertTrue(checker.compare(a, b, extras).isCompliant());
            assertFalse(checker.compare(a, c, extras).isCompliant());
            assertEquals("VendorSpecificBlob123", checker.compare(a, c, extras).getEvaluated().get(6));
        }

        @Test
        @DisplayName("Should resolve extras through aliases")
        void shouldResolveExtrasThroughAliases() {
            ImagingSequence a = ImagingSequence.fromDict("a", with("SliceThickness", 1.0));
            ImagingSequence b = ImagingSequence.fromDict("b", with("SliceThickness", 1.2));

            assertTrue(checker.compare(a, b).isCompliant());
            ComplianceResult result = checker.compare(a, b, Collections.singletonList("Slice thickness"));
            assertFalse(result.isCompliant());
            assertNotNull(result.getMismatch("SliceThickness"));
        }

        @Test
        @DisplayName("Should fold case and whitespace for exact parameters")
        void shouldFoldExactParameters() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("Manufacturer", " Siemens "));
            ImagingSequence c = ImagingSequence.fromDict("c", with("Manufacturer", "GE MEDICAL SYSTEMS"));

            ComplianceChecker withManufacturer = new ComplianceChecker(ParameterRegistry.getDefault(),
                    Collections.singletonList("Manufacturer"));
            assertTrue(withManufacturer.compare(a, b).isCompliant());
            assertFalse(withManufacturer.compare(a, c).isCompliant());
        }

        @Test
        @DisplayName("Should compare plain parameter maps")
        void shouldCompareParameterMaps() {
            ImagingSequence a = ImagingSequence.fromDict("a", fullDict());
            ImagingSequence b = ImagingSequence.fromDict("b", with("EchoTime", 31));

            ComplianceResult result = checker.compareParameters(a.getParameters(), b.getParameters(),
                    Collections.<String>emptyList());
            assertEquals(1, result.getMismatches().size());
            assertEquals("EchoTime", result.getMismatches().get(0).getName());
        }
    }

    @Nested
    @DisplayName("Protocol Comparison Tests")
    class ProtocolComparisonTests {

        @Test
        @DisplayName("Should report per-sequence results and missing sequences")
        void shouldCompareProtocols() throws DuplicateSequenceException {
            ImagingProtocol reference = new ImagingProtocol("reference");
            reference.addSequenceFromDict("t1w", fullDict());
            reference.addSequenceFromDict("bold", with("RepetitionTime", 800));
            reference.addSequenceFromDict("dwi", fullDict());

            ImagingProtocol candidate = new ImagingProtocol("session-01");
            candidate.addSequenceFromDict("t1w", fullDict());
            candidate.addSequenceFromDict("bold", with("RepetitionTime", 1000));
            candidate.addSequenceFromDict("localizer", fullDict());

            ProtocolComplianceReport report = checker.compareProtocols(reference, candidate);

            assertFalse(report.isCompliant());
            assertEquals(Arrays.asList("t1w", "bold"), Arrays.asList(report.getResults().keySet().toArray()));
            assertTrue(report.getResult("t1w").isCompliant());
            assertEquals(Collections.singletonList("bold"), report.getNonCompliantSequences());
            assertEquals(Collections.singletonList("dwi"), report.getMissingSequences());
            assertEquals(Collections.singletonList("localizer"), report.getExtraSequences());
            assertTrue(report.toString().contains("dwi (missing)"));
        }

        @Test
        @DisplayName("Should accept a protocol compared with itself")
        void shouldAcceptIdenticalProtocols() throws DuplicateSequenceException {
            ImagingProtocol reference = new ImagingProtocol("reference");
            reference.addSequenceFromDict("t1w", fullDict());

            assertTrue(checker.compareProtocols(reference, reference).isCompliant());
        }
    }
}
