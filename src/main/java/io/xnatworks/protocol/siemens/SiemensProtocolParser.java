/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.siemens;

import io.xnatworks.protocol.imaging.DuplicateSequenceException;
import io.xnatworks.protocol.imaging.ImagingProtocol;
import io.xnatworks.protocol.imaging.ParseIssue;
import io.xnatworks.protocol.imaging.ProtocolParseException;
import io.xnatworks.protocol.parameter.EquivalenceRule;
import io.xnatworks.protocol.parameter.ParameterDefinition;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.sequence.SequenceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a Siemens "PrintProtocol" XML export into an {@link ImagingProtocol}.
 *
 * <pre>
 * &lt;PrintProtocol&gt;
 *   &lt;Protocol&gt;
 *     &lt;SubStep&gt;
 *       &lt;ProtHeaderInfo&gt;&lt;HeaderProtPath&gt;...\program\t1_mprage&lt;/HeaderProtPath&gt;&lt;/ProtHeaderInfo&gt;
 *       &lt;Card name="Routine"&gt;
 *         &lt;ProtParameter&gt;&lt;Label&gt;TR&lt;/Label&gt;&lt;ValueAndUnit&gt;2300 ms&lt;/ValueAndUnit&gt;&lt;/ProtParameter&gt;
 *       &lt;/Card&gt;
 *     &lt;/SubStep&gt;
 * </pre>
 *
 * Each {@code SubStep} becomes one sequence. Only blocks of one program are read: the
 * configured program, or else the first one in the document. A block that cannot be read
 * is recorded as a {@link ParseIssue} and, if its name is known, kept with all of its
 * fields unrecognized. Only a document that cannot be read at all fails the parse.
 */
public class SiemensProtocolParser {
    private static final Logger log = LoggerFactory.getLogger(SiemensProtocolParser.class);

    public static final String DEFAULT_PROTOCOL_NAME = "SiemensMRProtocol";

    private static final String PHASE_ENCODING_DIRECTION = "PhaseEncodingDirection";

    private final ParameterRegistry registry;
    private final String programName;
    private final boolean convertPhaseEncoding;

    public SiemensProtocolParser() {
        this(ParameterRegistry.getDefault(), null, true);
    }

    /**
     * @param programName          program whose sequences are read, or null for the first one found
     * @param convertPhaseEncoding map anatomical phase directions ("A &gt;&gt; P") to DICOM ROW/COL
     */
    public SiemensProtocolParser(ParameterRegistry registry, String programName, boolean convertPhaseEncoding) {
        this.registry = registry;
        this.programName = programName;
        this.convertPhaseEncoding = convertPhaseEncoding;
    }

    public ImagingProtocol parse(InputStream in) throws ProtocolParseException {
        Document document;
        try {
            document = newDocumentBuilder().parse(new InputSource(in));
        } catch (SAXException | IOException e) {
            throw new ProtocolParseException("Unreadable protocol document: " + e.getMessage(), e);
        }
        return parse(document);
    }

    public ImagingProtocol parse(Document document) throws ProtocolParseException {
        List<Element> steps = findSubSteps(document);
        List<String> programs = findProgramNames(steps);

        String selected = programName;
        if (selected == null || selected.trim().isEmpty()) {
            selected = programs.isEmpty() ? null : programs.get(0);
        } else if (!programs.contains(selected)) {
            throw new ProtocolParseException("Program '" + selected + "' not found in protocol; available: " + programs);
        }

        ImagingProtocol protocol = new ImagingProtocol(headerTitle(document), registry);
        log.info("Parsing protocol {}: {} sequence blocks, program {}", protocol.getName(), steps.size(), selected);

        for (int i = 0; i < steps.size(); i++) {
            parseBlock(protocol, steps.get(i), i + 1, selected);
        }

        if (!protocol.getParseIssues().isEmpty()) {
            log.warn("Protocol {} parsed with {} problem blocks", protocol.getName(), protocol.getParseIssues().size());
        }
        log.info("Parsed protocol {} with {} sequences", protocol.getName(), protocol.size());
        return protocol;
    }

    /**
     * Programs referenced by the sequence blocks, in document order.
     */
    public List<String> findProgramNames(Document document) throws ProtocolParseException {
        return findProgramNames(findSubSteps(document));
    }

    private List<String> findProgramNames(List<Element> steps) {
        Set<String> programs = new LinkedHashSet<>();
        for (Element step : steps) {
            String[] path = splitPath(headerPath(step));
            if (path != null) {
                programs.add(path[0]);
            }
        }
        return new ArrayList<>(programs);
    }

    private List<Element> findSubSteps(Document document) throws ProtocolParseException {
        NodeList printProtocols = document.getElementsByTagName("PrintProtocol");
        if (printProtocols.getLength() == 0) {
            throw new ProtocolParseException("Document has no PrintProtocol section");
        }
        List<Element> steps = new ArrayList<>();
        for (int p = 0; p < printProtocols.getLength(); p++) {
            NodeList found = ((Element) printProtocols.item(p)).getElementsByTagName("SubStep");
            for (int i = 0; i < found.getLength(); i++) {
                steps.add((Element) found.item(i));
            }
        }
        return steps;
    }

    private void parseBlock(ImagingProtocol protocol, Element step, int index, String selected) {
        String sequenceName = null;
        Map<String, String> entries = new LinkedHashMap<>();
        try {
            String rawPath = headerPath(step);
            String[] path = splitPath(rawPath);
            if (path == null) {
                throw new MalformedBlockException("Block " + index + " has no usable HeaderProtPath");
            }
            if (!path[0].equals(selected)) {
                log.debug("Skipping block {} of program {}", path[1], path[0]);
                return;
            }
            sequenceName = sanitizeName(path[1]);
            if (sequenceName.isEmpty()) {
                sequenceName = null;
                throw new MalformedBlockException("Block " + index + " has an empty sequence name");
            }

            collectEntries(step, entries);
            if (protocol.containsSequence(sequenceName)) {
                throw new MalformedBlockException("Sequence name '" + sequenceName + "' used by more than one block");
            }

            SequenceBuilder builder = new SequenceBuilder(registry)
                    .name(sequenceName)
                    .source("xml:" + rawPath.trim());
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                builder.put(entry.getKey(), convertValue(entry.getKey(), entry.getValue()));
            }
            protocol.addSequence(sequenceName, builder.build());
        } catch (MalformedBlockException | DuplicateSequenceException | RuntimeException e) {
            log.warn("Problem in sequence block {} ({}): {}", index, sequenceName, e.getMessage());
            protocol.addParseIssue(new ParseIssue(sequenceName, String.valueOf(e.getMessage())));
            if (sequenceName != null && !protocol.containsSequence(sequenceName)) {
                addUnrecognized(protocol, sequenceName, entries);
            }
        }
    }

    /**
     * Collect every labelled value of a block, one per label. Parameters without a label
     * are noted and the block is rejected only after the rest have been collected.
     */
    private void collectEntries(Element step, Map<String, String> entries) throws MalformedBlockException {
        Map<String, Map<String, String>> byLabel = new LinkedHashMap<>();
        Set<String> unlabeled = new LinkedHashSet<>();
        for (Element card : childElements(step, "Card")) {
            String cardName = card.getAttribute("name");
            NodeList parameters = card.getElementsByTagName("ProtParameter");
            for (int i = 0; i < parameters.getLength(); i++) {
                Element parameter = (Element) parameters.item(i);
                String label = childText(parameter, "Label");
                if (label == null || label.isEmpty()) {
                    log.debug("Parameter {} of card '{}' has no label", i + 1, cardName);
                    unlabeled.add(cardName);
                    continue;
                }
                String value = childText(parameter, "ValueAndUnit");
                Map<String, String> cards = byLabel.computeIfAbsent(label, k -> new LinkedHashMap<>());
                if (cards.containsKey(cardName)) {
                    log.debug("Repeated label '{}' in card '{}' ignored", label, cardName);
                    continue;
                }
                cards.put(cardName, value != null ? value : "");
            }
        }

        for (Map.Entry<String, Map<String, String>> entry : byLabel.entrySet()) {
            entries.put(entry.getKey(), selectCard(entry.getKey(), entry.getValue()));
        }
        if (!unlabeled.isEmpty()) {
            throw new MalformedBlockException("Parameter without a label in card '" + String.join("', '", unlabeled) + "'");
        }
    }

    /**
     * Pick the value of a label found on several cards: the registry's card for the
     * parameter when present, otherwise the card whose name sorts first.
     */
    String selectCard(String label, Map<String, String> byCard) {
        if (byCard.size() == 1) {
            return byCard.values().iterator().next();
        }
        Optional<ParameterDefinition> def = registry.resolve(label);
        String preferred = def.isPresent() && def.get().getXmlCard() != null
                ? EquivalenceRule.fold(def.get().getXmlCard()) : null;
        String chosen = null;
        for (String card : byCard.keySet()) {
            if (EquivalenceRule.fold(card).equals(preferred)) {
                chosen = card;
                break;
            }
            if (chosen == null || card.compareTo(chosen) < 0) {
                chosen = card;
            }
        }
        log.debug("Label '{}' appears on cards {}; reading card '{}'", label, byCard.keySet(), chosen);
        return byCard.get(chosen);
    }

    private void addUnrecognized(ImagingProtocol protocol, String sequenceName, Map<String, String> entries) {
        SequenceBuilder fallback = new SequenceBuilder(registry).name(sequenceName).source("xml:unparsed");
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                fallback.putUnrecognized(entry.getKey(), entry.getValue());
            }
        }
        try {
            protocol.addSequence(sequenceName, fallback.build());
        } catch (DuplicateSequenceException e) {
            throw new IllegalStateException("Sequence " + sequenceName + " appeared while recovering its block", e);
        }
    }

    /**
     * Phase encoding directions are exported anatomically; DICOM uses ROW/COL.
     */
    String convertValue(String label, String value) {
        if (!convertPhaseEncoding) {
            return value;
        }
        Optional<ParameterDefinition> def = registry.resolve(label);
        if (!def.isPresent() || !PHASE_ENCODING_DIRECTION.equals(def.get().getName())) {
            return value;
        }
        String folded = EquivalenceRule.fold(value);
        if ("A>>P".equals(folded) || "P>>A".equals(folded)) {
            return "COL";
        }
        if ("R>>L".equals(folded) || "L>>R".equals(folded)) {
            return "ROW";
        }
        return value;
    }

    private String headerTitle(Document document) {
        NodeList tocs = document.getElementsByTagName("PrintTOC");
        if (tocs.getLength() > 0) {
            NodeList titles = ((Element) tocs.item(0)).getElementsByTagName("HeaderTitle");
            if (titles.getLength() > 0) {
                String title = titles.item(0).getTextContent().trim();
                if (!title.isEmpty()) {
                    return title;
                }
            }
        }
        return DEFAULT_PROTOCOL_NAME;
    }

    private static String headerPath(Element step) {
        for (Element info : childElements(step, "ProtHeaderInfo")) {
            String path = childText(info, "HeaderProtPath");
            if (path != null) {
                return path;
            }
        }
        return null;
    }

    /**
     * @return {program, sequence} from the last two path segments, or null
     */
    private static String[] splitPath(String headerPath) {
        if (headerPath == null) {
            return null;
        }
        String[] parts = headerPath.trim().split("\\\\");
        if (parts.length < 2 || parts[parts.length - 2].trim().isEmpty()) {
            return null;
        }
        return new String[]{parts[parts.length - 2].trim(), parts[parts.length - 1].trim()};
    }

    /**
     * ASCII-only sequence names: accented letters lose their accent, whitespace becomes
     * '_', other characters outside letters, digits and {@code _ - . +} are dropped.
     */
    static String sanitizeName(String name) {
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("\\p{M}+", "");
        String collapsed = decomposed.trim().replaceAll("\\s+", "_");
        StringBuilder sb = new StringBuilder();
        for (char c : collapsed.toCharArray()) {
            if (c < 128 && (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '+')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && tagName.equals(child.getNodeName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static String childText(Element parent, String tagName) {
        List<Element> children = childElements(parent, tagName);
        return children.isEmpty() ? null : children.get(0).getTextContent().trim();
    }

    private static DocumentBuilder newDocumentBuilder() throws ProtocolParseException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new ProtocolParseException("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * Routes parser diagnostics to the log instead of stderr; errors still abort the parse.
     */
    private static class LoggingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    /**
     * A sequence block that cannot be read; the rest of the document is unaffected.
     */
    private static class MalformedBlockException extends Exception {
        MalformedBlockException(String message) {
            super(message);
        }
    }
}
