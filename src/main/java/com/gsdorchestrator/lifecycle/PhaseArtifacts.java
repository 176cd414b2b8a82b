package com.gsdorchestrator.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a phase directory contains: plan and summary ids plus the single-file markers.
 */
public class PhaseArtifacts {

    private final String phaseNumber;
    private final String phaseName;
    private final String phaseDirectory;
    private final List<String> planIds;
    private final List<String> summaryIds;
    private final boolean hasContext;
    private final boolean hasResearch;
    private final boolean hasUat;
    private final boolean hasVerification;

    public PhaseArtifacts(String phaseNumber, String phaseName, String phaseDirectory, List<String> planIds,
                          List<String> summaryIds, boolean hasContext, boolean hasResearch, boolean hasUat,
                          boolean hasVerification) {
        this.phaseNumber = phaseNumber;
        this.phaseName = phaseName;
        this.phaseDirectory = phaseDirectory;
        this.planIds = planIds != null ? List.copyOf(planIds) : Collections.emptyList();
        this.summaryIds = summaryIds != null ? List.copyOf(summaryIds) : Collections.emptyList();
        this.hasContext = hasContext;
        this.hasResearch = hasResearch;
        this.hasUat = hasUat;
        this.hasVerification = hasVerification;
    }

    public static PhaseArtifacts empty(String phaseNumber, String phaseName, String phaseDirectory) {
        return new PhaseArtifacts(phaseNumber, phaseName, phaseDirectory, null, null, false, false, false, false);
    }

    public String getPhaseNumber() {
        return phaseNumber;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public String getPhaseDirectory() {
        return phaseDirectory;
    }

    public List<String> getPlanIds() {
        return planIds;
    }

    public List<String> getSummaryIds() {
        return summaryIds;
    }

    public int getPlanCount() {
        return planIds.size();
    }

    public int getSummaryCount() {
        return summaryIds.size();
    }

    /**
     * Plan ids with no matching summary, in plan order.
     */
    public List<String> getUnexecutedPlans() {
        List<String> result = new ArrayList<>();
        for (String id : planIds) {
            if (!summaryIds.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    public boolean isHasContext() {
        return hasContext;
    }

    public boolean isHasResearch() {
        return hasResearch;
    }

    public boolean isHasUat() {
        return hasUat;
    }

    public boolean isHasVerification() {
        return hasVerification;
    }
}
