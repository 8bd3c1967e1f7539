package com.di.suitesplit.naming;

import com.di.suitesplit.split.SubSuite;

/**
 * Names generated sub-suites and their tasks.
 *
 * <p>Indexed names embed the zero-padded index and the total count, e.g.
 * {@code jsCore_03_12_linux-64}. Names are stable only for identical split output: a different
 * sub-suite count renames every task.
 */
public class SubSuiteIdentity {

    static final String MISC_SUFFIX = "_misc";
    static final String SUITE_FILE_EXTENSION = ".yml";

    /**
     * Task name for an indexed sub-suite: {@code <base>_<index>_<total>[_<buildVariant>]}.
     */
    public String name(String baseName, SubSuite subSuite, int totalSubSuites, String buildVariant) {
        if (subSuite.isMisc()) {
            return miscTaskName(baseName, buildVariant);
        }
        return baseName + "_" + indexed(subSuite.getIndex(), totalSubSuites) + variantSuffix(buildVariant);
    }

    /** Task name for the misc suite: {@code <base>_misc[_<buildVariant>]}. */
    public String miscTaskName(String baseName, String buildVariant) {
        return baseName + MISC_SUFFIX + variantSuffix(buildVariant);
    }

    /** Suite name for an indexed sub-suite: {@code <origin basename>_<index>_<total>}. */
    public String suiteName(String originSuite, SubSuite subSuite, int totalSubSuites) {
        if (subSuite.isMisc()) {
            return miscName(originSuite);
        }
        return baseName(originSuite) + "_" + indexed(subSuite.getIndex(), totalSubSuites);
    }

    /** Suite name of the misc remainder: {@code <origin basename>_misc}. */
    public String miscName(String originSuite) {
        return baseName(originSuite) + MISC_SUFFIX;
    }

    /** File the generated suite definition is written to: {@code <suiteName>_<buildVariant>.yml}. */
    public String suiteFileName(String suiteName, String buildVariant) {
        return suiteName + variantSuffix(buildVariant) + SUITE_FILE_EXTENSION;
    }

    static String indexed(int index, int total) {
        if (index < 0 || index >= Math.max(total, 1)) {
            throw new IllegalArgumentException("Sub-suite index " + index + " outside [0, " + total + ")");
        }
        int width = String.valueOf(Math.max(total - 1, 0)).length();
        StringBuilder padded = new StringBuilder(String.valueOf(index));
        while (padded.length() < width) {
            padded.insert(0, '0');
        }
        return padded + "_" + total;
    }

    static String baseName(String suite) {
        String normalized = suite.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String name = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        if (name.endsWith(SUITE_FILE_EXTENSION)) {
            name = name.substring(0, name.length() - SUITE_FILE_EXTENSION.length());
        }
        return name;
    }

    private static String variantSuffix(String buildVariant) {
        return buildVariant == null || buildVariant.isBlank() ? "" : "_" + buildVariant;
    }
}
