/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.protocol.compliance.ComplianceChecker;
import io.xnatworks.protocol.parameter.ParameterRegistry;
import io.xnatworks.protocol.siemens.SiemensProtocolParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Compliance engine configuration, loaded from YAML.
 *
 * <pre>
 * registry_file: site-registry.yaml
 * extra_parameters: [SliceThickness, MultiSliceMode]
 * siemens:
 *   program_name: ABCD
 *   convert_phase_encoding: true
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComplianceConfig {
    private static final Logger log = LoggerFactory.getLogger(ComplianceConfig.class);

    /**
     * Parameter registry table to use instead of the bundled one. Relative paths are
     * resolved against the directory of the configuration file.
     */
    @JsonProperty("registry_file")
    private String registryFile;

    /**
     * Parameters compared in addition to the registry's required ones.
     */
    @JsonProperty("extra_parameters")
    private List<String> extraParameters = new ArrayList<>();

    private SiemensConfig siemens = new SiemensConfig();

    @JsonIgnore
    private File configFile;

    public static ComplianceConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ComplianceConfig config = mapper.readValue(configFile, ComplianceConfig.class);
        config.configFile = configFile;
        return config;
    }

    public static ComplianceConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    /**
     * The configured registry, or the bundled one when no registry file is set.
     */
    public ParameterRegistry createRegistry() throws IOException {
        if (registryFile == null || registryFile.trim().isEmpty()) {
            return ParameterRegistry.getDefault();
        }
        File file = new File(registryFile);
        if (!file.isAbsolute() && configFile != null && configFile.getAbsoluteFile().getParentFile() != null) {
            file = new File(configFile.getAbsoluteFile().getParentFile(), registryFile);
        }
        return ParameterRegistry.load(file);
    }

    public ComplianceChecker createChecker(ParameterRegistry registry) {
        return new ComplianceChecker(registry, extraParameters);
    }

    public SiemensProtocolParser createParser(ParameterRegistry registry) {
        SiemensConfig settings = siemens != null ? siemens : new SiemensConfig();
        return new SiemensProtocolParser(registry, settings.getProgramName(), settings.isConvertPhaseEncoding());
    }

    @JsonIgnore
    public File getConfigFile() { return configFile; }

    public String getRegistryFile() { return registryFile; }
    public void setRegistryFile(String registryFile) { this.registryFile = registryFile; }

    public List<String> getExtraParameters() { return extraParameters; }
    public void setExtraParameters(List<String> extraParameters) { this.extraParameters = extraParameters; }

    public SiemensConfig getSiemens() { return siemens; }
    public void setSiemens(SiemensConfig siemens) { this.siemens = siemens; }

    /**
     * Siemens PrintProtocol import settings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SiemensConfig {
        @JsonProperty("program_name")
        private String programName;

        @JsonProperty("convert_phase_encoding")
        private boolean convertPhaseEncoding = true;

        public String getProgramName() { return programName; }
        public void setProgramName(String programName) { this.programName = programName; }

        public boolean isConvertPhaseEncoding() { return convertPhaseEncoding; }
        public void setConvertPhaseEncoding(boolean convertPhaseEncoding) { this.convertPhaseEncoding = convertPhaseEncoding; }
    }
}
