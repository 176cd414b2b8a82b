package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.DiscoveryWarning;

import java.util.List;

/**
 * Single-entry cache of the last discovery scan, keyed by base path and version-marker mtime.
 * The entry is swapped as a whole, so readers never observe a half-written result.
 */
public class DiscoveryCache {

    private volatile Entry entry;

    public Entry get(String basePath, long versionMtime) {
        Entry current = entry;
        if (current == null || versionMtime == 0L) {
            return null;
        }
        if (current.versionMtime != versionMtime || !current.basePath.equals(basePath)) {
            return null;
        }
        return current;
    }

    public void put(String basePath, long versionMtime, DiscoveryResult result, List<DiscoveryWarning> warnings) {
        if (versionMtime == 0L) {
            return;
        }
        entry = new Entry(basePath, versionMtime, result, warnings);
    }

    public void clear() {
        entry = null;
    }

    public boolean isEmpty() {
        return entry == null;
    }

    public static final class Entry {
        private final String basePath;
        private final long versionMtime;
        private final DiscoveryResult result;
        private final List<DiscoveryWarning> warnings;

        private Entry(String basePath, long versionMtime, DiscoveryResult result, List<DiscoveryWarning> warnings) {
            this.basePath = basePath;
            this.versionMtime = versionMtime;
            this.result = result;
            this.warnings = List.copyOf(warnings);
        }

        public DiscoveryResult getResult() {
            return result;
        }

        public List<DiscoveryWarning> getWarnings() {
            return warnings;
        }

        public long getVersionMtime() {
            return versionMtime;
        }
    }
}
