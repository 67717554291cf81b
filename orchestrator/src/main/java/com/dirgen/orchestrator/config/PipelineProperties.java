package com.dirgen.orchestrator.config;

import com.dirgen.orchestrator.model.GateKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Run workflow settings ({@code dirgen.pipeline.*}).
 *
 * @param sandboxRoot           root directory of the filesystem gateway
 * @param inputDir              directory (relative to the sandbox) holding stage inputs
 * @param designInputSuffix     suffix of the structured input the requirements worker writes
 * @param maxRetries            design retries granted per run before it is rejected
 * @param approvalGates         gates that wait for a human; the others pass automatically
 * @param executionStageEnabled whether a passed validation launches the execution stage
 */
@ConfigurationProperties(prefix = "dirgen.pipeline")
public record PipelineProperties(
        @DefaultValue(".")                         String       sandboxRoot,
        @DefaultValue("temp")                      String       inputDir,
        @DefaultValue("_pcce.yml")                 String       designInputSuffix,
        @DefaultValue("3")                         int          maxRetries,
        @DefaultValue({"start-design", "execute-plan"}) List<String> approvalGates,
        @DefaultValue("false")                     boolean      executionStageEnabled
) {

    public PipelineProperties {
        approvalGates = approvalGates == null ? List.of() : List.copyOf(approvalGates);
    }

    /** The configured gates, decoded. */
    public Set<GateKind> humanGates() {
        Set<GateKind> gates = EnumSet.noneOf(GateKind.class);
        approvalGates.forEach(g -> gates.add(GateKind.fromWire(g)));
        return gates;
    }

    public String requirementsInputPath(String runId) {
        return inputDir + "/" + runId + "_input.md";
    }

    public String designInputPath(String runId) {
        return inputDir + "/" + runId + designInputSuffix;
    }
}
