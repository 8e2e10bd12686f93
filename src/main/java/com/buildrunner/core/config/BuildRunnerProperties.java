package com.buildrunner.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code buildrunner.*} from application.yml / environment variables.
 */
@ConfigurationProperties(prefix = "buildrunner")
public class BuildRunnerProperties {

    private boolean quietMode = false;
    private String parallelism = "max";
    private boolean changedProjectsOnly = false;
    private boolean allowWarningsInSuccessfulBuild = false;

    public boolean isQuietMode() {
        return quietMode;
    }

    public void setQuietMode(boolean quietMode) {
        this.quietMode = quietMode;
    }

    public String getParallelism() {
        return parallelism;
    }

    public void setParallelism(String parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isChangedProjectsOnly() {
        return changedProjectsOnly;
    }

    public void setChangedProjectsOnly(boolean changedProjectsOnly) {
        this.changedProjectsOnly = changedProjectsOnly;
    }

    public boolean isAllowWarningsInSuccessfulBuild() {
        return allowWarningsInSuccessfulBuild;
    }

    public void setAllowWarningsInSuccessfulBuild(boolean allowWarningsInSuccessfulBuild) {
        this.allowWarningsInSuccessfulBuild = allowWarningsInSuccessfulBuild;
    }
}
