package com.reelpilot.config;

import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.WorkflowType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "session")
public class SessionProperties {
    private String accountId = "default";
    private Device device = new Device();
    private Navigation navigation = new Navigation();
    private Defaults defaults = new Defaults();
    private Recovery recovery = new Recovery();
    private Ledger ledger = new Ledger();
    private Cli cli = new Cli();
    private Map<String, List<String>> locators = new LinkedHashMap<>();
    private Map<String, List<String>> locatorAlternates = new LinkedHashMap<>();

    public String getAccountId() {
        return accountId == null || accountId.isBlank() ? "default" : accountId.trim();
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public Device getDevice() {
        return device;
    }

    public void setDevice(Device device) {
        this.device = device;
    }

    public Navigation getNavigation() {
        return navigation;
    }

    public void setNavigation(Navigation navigation) {
        this.navigation = navigation;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public void setLedger(Ledger ledger) {
        this.ledger = ledger;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, List<String>> getLocators() {
        return locators;
    }

    public void setLocators(Map<String, List<String>> locators) {
        this.locators = locators;
    }

    public Map<String, List<String>> getLocatorAlternates() {
        return locatorAlternates;
    }

    public void setLocatorAlternates(Map<String, List<String>> locatorAlternates) {
        this.locatorAlternates = locatorAlternates;
    }

    /**
     * Run configuration pre-filled with the configured defaults; callers override per request.
     */
    public RunConfig.Builder newRunConfig(WorkflowType workflowType) {
        return RunConfig.builder(workflowType)
            .accountId(getAccountId())
            .maxTargets(defaults.getMaxTargets())
            .likeProbability(defaults.getLikeProbability())
            .followProbability(defaults.getFollowProbability())
            .favoriteProbability(defaults.getFavoriteProbability())
            .commentProbability(defaults.getCommentProbability())
            .shareProbability(defaults.getShareProbability())
            .storyLikeProbability(defaults.getStoryLikeProbability())
            .maxLikesPerSession(defaults.getMaxLikesPerSession())
            .maxFollowsPerSession(defaults.getMaxFollowsPerSession())
            .maxCommentsPerSession(defaults.getMaxCommentsPerSession())
            .maxUnfollows(defaults.getMaxUnfollows())
            .maxConversations(defaults.getMaxConversations())
            .pauseAfterActions(defaults.getPauseAfterActions())
            .pauseDuration(defaults.getPauseMinSeconds(), defaults.getPauseMaxSeconds())
            .delay(defaults.getMinDelaySeconds(), defaults.getMaxDelaySeconds())
            .watchSeconds(defaults.getMinWatchSeconds(), defaults.getMaxWatchSeconds())
            .postsPerProfile(defaults.getPostsPerProfile())
            .commentTemplates(defaults.getCommentTemplates())
            .messageTemplates(defaults.getMessageTemplates())
            .cooldownHours(ledger.getCooldownHours())
            .stuckThreshold(recovery.getStuckThreshold())
            .maxErrors(recovery.getMaxErrors());
    }

    public static class Device {
        private boolean enabled;
        private String url = "http://127.0.0.1:7912";
        private String adbPath = "adb";
        private String serial;
        private String appPackage = "com.zhiliaoapp.musically";
        private int lookupTimeoutMs = 1500;
        private int actionTimeoutMs = 5000;
        private int requestTimeoutSeconds = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getAdbPath() {
            return adbPath;
        }

        public void setAdbPath(String adbPath) {
            this.adbPath = adbPath;
        }

        public String getSerial() {
            return serial;
        }

        public void setSerial(String serial) {
            this.serial = serial;
        }

        public String getAppPackage() {
            return appPackage;
        }

        public void setAppPackage(String appPackage) {
            this.appPackage = appPackage;
        }

        public int getLookupTimeoutMs() {
            return Math.max(1, lookupTimeoutMs);
        }

        public void setLookupTimeoutMs(int lookupTimeoutMs) {
            this.lookupTimeoutMs = Math.max(1, lookupTimeoutMs);
        }

        public int getActionTimeoutMs() {
            return Math.max(1, actionTimeoutMs);
        }

        public void setActionTimeoutMs(int actionTimeoutMs) {
            this.actionTimeoutMs = Math.max(1, actionTimeoutMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Navigation {
        private int pollIntervalMs = 250;
        private int stepTimeoutMs = 5000;
        private int stepRetries = 2;

        public int getPollIntervalMs() {
            return Math.max(1, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(1, pollIntervalMs);
        }

        public int getStepTimeoutMs() {
            return Math.max(1, stepTimeoutMs);
        }

        public void setStepTimeoutMs(int stepTimeoutMs) {
            this.stepTimeoutMs = Math.max(1, stepTimeoutMs);
        }

        public int getStepRetries() {
            return Math.max(0, stepRetries);
        }

        public void setStepRetries(int stepRetries) {
            this.stepRetries = Math.max(0, stepRetries);
        }
    }

    public static class Defaults {
        private double likeProbability = 0.3;
        private double followProbability = 0.1;
        private double favoriteProbability = 0.05;
        private double commentProbability;
        private double shareProbability;
        private double storyLikeProbability = 0.5;
        private int maxTargets = 50;
        private int maxLikesPerSession = 50;
        private int maxFollowsPerSession = 20;
        private int maxCommentsPerSession = 10;
        private int maxUnfollows = 50;
        private int maxConversations = 20;
        private int pauseAfterActions = 10;
        private double pauseMinSeconds = 30;
        private double pauseMaxSeconds = 60;
        private double minDelaySeconds = 1;
        private double maxDelaySeconds = 3;
        private double minWatchSeconds = 2;
        private double maxWatchSeconds = 8;
        private int postsPerProfile = 2;
        private List<String> commentTemplates = new ArrayList<>();
        private List<String> messageTemplates = new ArrayList<>();

        public double getLikeProbability() {
            return Math.max(0.0, Math.min(1.0, likeProbability));
        }

        public void setLikeProbability(double likeProbability) {
            this.likeProbability = Math.max(0.0, Math.min(1.0, likeProbability));
        }

        public double getFollowProbability() {
            return Math.max(0.0, Math.min(1.0, followProbability));
        }

        public void setFollowProbability(double followProbability) {
            this.followProbability = Math.max(0.0, Math.min(1.0, followProbability));
        }

        public double getFavoriteProbability() {
            return Math.max(0.0, Math.min(1.0, favoriteProbability));
        }

        public void setFavoriteProbability(double favoriteProbability) {
            this.favoriteProbability = Math.max(0.0, Math.min(1.0, favoriteProbability));
        }

        public double getCommentProbability() {
            return Math.max(0.0, Math.min(1.0, commentProbability));
        }

        public void setCommentProbability(double commentProbability) {
            this.commentProbability = Math.max(0.0, Math.min(1.0, commentProbability));
        }

        public double getShareProbability() {
            return Math.max(0.0, Math.min(1.0, shareProbability));
        }

        public void setShareProbability(double shareProbability) {
            this.shareProbability = Math.max(0.0, Math.min(1.0, shareProbability));
        }

        public double getStoryLikeProbability() {
            return Math.max(0.0, Math.min(1.0, storyLikeProbability));
        }

        public void setStoryLikeProbability(double storyLikeProbability) {
            this.storyLikeProbability = Math.max(0.0, Math.min(1.0, storyLikeProbability));
        }

        public int getMaxTargets() {
            return Math.max(1, maxTargets);
        }

        public void setMaxTargets(int maxTargets) {
            this.maxTargets = Math.max(1, maxTargets);
        }

        public int getMaxLikesPerSession() {
            return Math.max(0, maxLikesPerSession);
        }

        public void setMaxLikesPerSession(int maxLikesPerSession) {
            this.maxLikesPerSession = Math.max(0, maxLikesPerSession);
        }

        public int getMaxFollowsPerSession() {
            return Math.max(0, maxFollowsPerSession);
        }

        public void setMaxFollowsPerSession(int maxFollowsPerSession) {
            this.maxFollowsPerSession = Math.max(0, maxFollowsPerSession);
        }

        public int getMaxCommentsPerSession() {
            return Math.max(0, maxCommentsPerSession);
        }

        public void setMaxCommentsPerSession(int maxCommentsPerSession) {
            this.maxCommentsPerSession = Math.max(0, maxCommentsPerSession);
        }

        public int getMaxUnfollows() {
            return Math.max(0, maxUnfollows);
        }

        public void setMaxUnfollows(int maxUnfollows) {
            this.maxUnfollows = Math.max(0, maxUnfollows);
        }

        public int getMaxConversations() {
            return Math.max(0, maxConversations);
        }

        public void setMaxConversations(int maxConversations) {
            this.maxConversations = Math.max(0, maxConversations);
        }

        public int getPauseAfterActions() {
            return Math.max(0, pauseAfterActions);
        }

        public void setPauseAfterActions(int pauseAfterActions) {
            this.pauseAfterActions = Math.max(0, pauseAfterActions);
        }

        public double getPauseMinSeconds() {
            return Math.max(0, pauseMinSeconds);
        }

        public void setPauseMinSeconds(double pauseMinSeconds) {
            this.pauseMinSeconds = Math.max(0, pauseMinSeconds);
        }

        public double getPauseMaxSeconds() {
            return Math.max(0, pauseMaxSeconds);
        }

        public void setPauseMaxSeconds(double pauseMaxSeconds) {
            this.pauseMaxSeconds = Math.max(0, pauseMaxSeconds);
        }

        public double getMinDelaySeconds() {
            return Math.max(0, minDelaySeconds);
        }

        public void setMinDelaySeconds(double minDelaySeconds) {
            this.minDelaySeconds = Math.max(0, minDelaySeconds);
        }

        public double getMaxDelaySeconds() {
            return Math.max(0, maxDelaySeconds);
        }

        public void setMaxDelaySeconds(double maxDelaySeconds) {
            this.maxDelaySeconds = Math.max(0, maxDelaySeconds);
        }

        public double getMinWatchSeconds() {
            return Math.max(0, minWatchSeconds);
        }

        public void setMinWatchSeconds(double minWatchSeconds) {
            this.minWatchSeconds = Math.max(0, minWatchSeconds);
        }

        public double getMaxWatchSeconds() {
            return Math.max(0, maxWatchSeconds);
        }

        public void setMaxWatchSeconds(double maxWatchSeconds) {
            this.maxWatchSeconds = Math.max(0, maxWatchSeconds);
        }

        public int getPostsPerProfile() {
            return Math.max(0, postsPerProfile);
        }

        public void setPostsPerProfile(int postsPerProfile) {
            this.postsPerProfile = Math.max(0, postsPerProfile);
        }

        public List<String> getCommentTemplates() {
            return commentTemplates;
        }

        public void setCommentTemplates(List<String> commentTemplates) {
            this.commentTemplates = commentTemplates;
        }

        public List<String> getMessageTemplates() {
            return messageTemplates;
        }

        public void setMessageTemplates(List<String> messageTemplates) {
            this.messageTemplates = messageTemplates;
        }
    }

    public static class Recovery {
        private int stuckThreshold = 3;
        private int maxErrors = 5;
        private int restartSettleSeconds = 4;

        public int getStuckThreshold() {
            return Math.max(2, stuckThreshold);
        }

        public void setStuckThreshold(int stuckThreshold) {
            this.stuckThreshold = Math.max(2, stuckThreshold);
        }

        public int getMaxErrors() {
            return Math.max(1, maxErrors);
        }

        public void setMaxErrors(int maxErrors) {
            this.maxErrors = Math.max(1, maxErrors);
        }

        public int getRestartSettleSeconds() {
            return Math.max(0, restartSettleSeconds);
        }

        public void setRestartSettleSeconds(int restartSettleSeconds) {
            this.restartSettleSeconds = Math.max(0, restartSettleSeconds);
        }
    }

    public static class Ledger {
        private int cooldownHours = 168;

        public int getCooldownHours() {
            return Math.max(0, cooldownHours);
        }

        public void setCooldownHours(int cooldownHours) {
            this.cooldownHours = Math.max(0, cooldownHours);
        }
    }

    public static class Cli {
        private boolean run;
        private String workflow = "feed";
        private String query = "";
        private String hashtag = "";
        private String targets = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getWorkflow() {
            return workflow;
        }

        public void setWorkflow(String workflow) {
            this.workflow = workflow;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getHashtag() {
            return hashtag;
        }

        public void setHashtag(String hashtag) {
            this.hashtag = hashtag;
        }

        public String getTargets() {
            return targets;
        }

        public void setTargets(String targets) {
            this.targets = targets;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
