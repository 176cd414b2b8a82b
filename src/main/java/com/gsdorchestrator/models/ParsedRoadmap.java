package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedRoadmap {

    private List<PhaseInfo> phases = new ArrayList<>();
    private Map<String, List<PlanInfo>> plansByPhase = new LinkedHashMap<>();
    private Map<String, List<CapabilityRef>> capabilitiesByPhase;

    public List<PhaseInfo> getPhases() {
        return phases;
    }

    public void setPhases(List<PhaseInfo> phases) {
        this.phases = phases != null ? phases : new ArrayList<>();
    }

    public Map<String, List<PlanInfo>> getPlansByPhase() {
        return plansByPhase;
    }

    public void setPlansByPhase(Map<String, List<PlanInfo>> plansByPhase) {
        this.plansByPhase = plansByPhase != null ? plansByPhase : new LinkedHashMap<>();
    }

    /**
     * Null when no phase declares capabilities.
     */
    public Map<String, List<CapabilityRef>> getCapabilitiesByPhase() {
        return capabilitiesByPhase;
    }

    public void setCapabilitiesByPhase(Map<String, List<CapabilityRef>> capabilitiesByPhase) {
        this.capabilitiesByPhase = capabilitiesByPhase;
    }
}
