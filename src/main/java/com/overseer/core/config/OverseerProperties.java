package com.overseer.core.config;

import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.Indicator;
import com.overseer.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "overseer")
public class OverseerProperties {

    private Duration pollInterval = Duration.ofSeconds(1);
    private int maxParallel = 8;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration statusInterval = Duration.ofSeconds(10);
    private boolean runnerNoop = false;
    private String gitBinary = "git";
    private String baseRef = "HEAD";

    private Workspace workspace = new Workspace();
    private Supervisor supervisor = new Supervisor();
    private Watchdog watchdog = new Watchdog();
    private Escalation escalation = new Escalation();
    private Lock lock = new Lock();
    private Events events = new Events();

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public Duration getStatusInterval() { return statusInterval; }
    public void setStatusInterval(Duration statusInterval) { this.statusInterval = statusInterval; }
    public boolean isRunnerNoop() { return runnerNoop; }
    public void setRunnerNoop(boolean runnerNoop) { this.runnerNoop = runnerNoop; }
    public String getGitBinary() { return gitBinary; }
    public void setGitBinary(String gitBinary) { this.gitBinary = gitBinary; }
    public String getBaseRef() { return baseRef; }
    public void setBaseRef(String baseRef) { this.baseRef = baseRef; }

    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Supervisor getSupervisor() { return supervisor; }
    public void setSupervisor(Supervisor supervisor) { this.supervisor = supervisor; }
    public Watchdog getWatchdog() { return watchdog; }
    public void setWatchdog(Watchdog watchdog) { this.watchdog = watchdog; }
    public Escalation getEscalation() { return escalation; }
    public void setEscalation(Escalation escalation) { this.escalation = escalation; }
    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public static class Workspace {
        /** Commit uncommitted work onto the task branch before its worktree is removed. */
        private boolean snapshotOnRelease = true;

        public boolean isSnapshotOnRelease() { return snapshotOnRelease; }
        public void setSnapshotOnRelease(boolean snapshotOnRelease) { this.snapshotOnRelease = snapshotOnRelease; }
    }

    public static class Supervisor {
        private Duration terminateGrace = Duration.ofSeconds(10);
        private int launchThreads = 4;
        private int monitorThreads = 4;

        public Duration getTerminateGrace() { return terminateGrace; }
        public void setTerminateGrace(Duration terminateGrace) { this.terminateGrace = terminateGrace; }
        public int getLaunchThreads() { return launchThreads; }
        public void setLaunchThreads(int launchThreads) { this.launchThreads = launchThreads; }
        public int getMonitorThreads() { return monitorThreads; }
        public void setMonitorThreads(int monitorThreads) { this.monitorThreads = monitorThreads; }
    }

    public static class Watchdog {
        private Duration checkInterval = Duration.ofSeconds(30);
        /** Overrides every task's check interval when set. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration intervalOverride;
        private Duration stuckThreshold = Duration.ofMinutes(15);
        private Set<Indicator> indicators = EnumSet.allOf(Indicator.class);
        private long logGrowthMinBytes = 64;
        private int patternWindowLines = 40;
        private int patternMinDistinct = 3;

        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
        public Duration getIntervalOverride() { return intervalOverride; }
        public void setIntervalOverride(Duration intervalOverride) { this.intervalOverride = intervalOverride; }
        public Duration getStuckThreshold() { return stuckThreshold; }
        public void setStuckThreshold(Duration stuckThreshold) { this.stuckThreshold = stuckThreshold; }
        public Set<Indicator> getIndicators() { return indicators; }
        public void setIndicators(Set<Indicator> indicators) { this.indicators = indicators; }
        public long getLogGrowthMinBytes() { return logGrowthMinBytes; }
        public void setLogGrowthMinBytes(long logGrowthMinBytes) { this.logGrowthMinBytes = logGrowthMinBytes; }
        public int getPatternWindowLines() { return patternWindowLines; }
        public void setPatternWindowLines(int patternWindowLines) { this.patternWindowLines = patternWindowLines; }
        public int getPatternMinDistinct() { return patternMinDistinct; }
        public void setPatternMinDistinct(int patternMinDistinct) { this.patternMinDistinct = patternMinDistinct; }
    }

    public static class Escalation {
        private List<EscalationStrategy> strategies = new ArrayList<>(
                List.of(EscalationStrategy.NOTIFY, EscalationStrategy.KILL_AND_RETRY));
        private int maxRetries = 3;
        private Duration notifyGrace = Duration.ofSeconds(60);
        private Duration interruptGrace = Duration.ofSeconds(120);

        public List<EscalationStrategy> getStrategies() { return strategies; }
        public void setStrategies(List<EscalationStrategy> strategies) { this.strategies = strategies; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getNotifyGrace() { return notifyGrace; }
        public void setNotifyGrace(Duration notifyGrace) { this.notifyGrace = notifyGrace; }
        public Duration getInterruptGrace() { return interruptGrace; }
        public void setInterruptGrace(Duration interruptGrace) { this.interruptGrace = interruptGrace; }
    }

    public static class Lock {
        private Set<Phase> privilegedPhases = EnumSet.of(Phase.MAIN);
        private String fileName = "framework-run.lock";

        public Set<Phase> getPrivilegedPhases() { return privilegedPhases; }
        public void setPrivilegedPhases(Set<Phase> privilegedPhases) { this.privilegedPhases = privilegedPhases; }
        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
    }

    public static class Events {
        private String fileName = "framework-run.jsonl";
        /** Force every appended record to the storage device, not just the OS cache. */
        private boolean fsync = false;

        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
        public boolean isFsync() { return fsync; }
        public void setFsync(boolean fsync) { this.fsync = fsync; }
    }
}
