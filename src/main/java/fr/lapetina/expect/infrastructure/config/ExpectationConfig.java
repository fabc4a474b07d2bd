package fr.lapetina.expect.infrastructure.config;

/**
 * Root configuration object for expectations.
 * Designed to be populated from YAML.
 */
public class ExpectationConfig {

    private ReporterConfig reporter = new ReporterConfig();
    private FormatterConfig formatter = new FormatterConfig();

    public ReporterConfig getReporter() { return reporter; }
    public void setReporter(ReporterConfig reporter) { this.reporter = reporter; }

    public FormatterConfig getFormatter() { return formatter; }
    public void setFormatter(FormatterConfig formatter) { this.formatter = formatter; }

    /**
     * Reporter selection and layout of the failure message.
     */
    public static class ReporterConfig {
        private String type = "text";
        private String verb = "expected the subject";
        private String thrownVerb = "expected the thrown exception";
        private int indent = 4;
        private String rootBullet = "◆";
        private String nestedBullet = "◾";
        private String featureArrow = "▶";
        private String explanationBullet = "»";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getVerb() { return verb; }
        public void setVerb(String verb) { this.verb = verb; }

        public String getThrownVerb() { return thrownVerb; }
        public void setThrownVerb(String thrownVerb) { this.thrownVerb = thrownVerb; }

        public int getIndent() { return indent; }
        public void setIndent(int indent) { this.indent = indent; }

        public String getRootBullet() { return rootBullet; }
        public void setRootBullet(String rootBullet) { this.rootBullet = rootBullet; }

        public String getNestedBullet() { return nestedBullet; }
        public void setNestedBullet(String nestedBullet) { this.nestedBullet = nestedBullet; }

        public String getFeatureArrow() { return featureArrow; }
        public void setFeatureArrow(String featureArrow) { this.featureArrow = featureArrow; }

        public String getExplanationBullet() { return explanationBullet; }
        public void setExplanationBullet(String explanationBullet) { this.explanationBullet = explanationBullet; }
    }

    /**
     * How subjects and expected values are printed.
     */
    public static class FormatterConfig {
        private boolean showTypes = false;
        private int maxStringLength = 1000;
        private String notAvailablePrefix = "❗❗";

        public boolean isShowTypes() { return showTypes; }
        public void setShowTypes(boolean showTypes) { this.showTypes = showTypes; }

        public int getMaxStringLength() { return maxStringLength; }
        public void setMaxStringLength(int maxStringLength) { this.maxStringLength = maxStringLength; }

        public String getNotAvailablePrefix() { return notAvailablePrefix; }
        public void setNotAvailablePrefix(String notAvailablePrefix) { this.notAvailablePrefix = notAvailablePrefix; }
    }
}
