package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.ProfileSnapshot;
import com.reelpilot.session.model.ScrapeSource;
import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.recovery.SmartScrollBudget;
import com.reelpilot.session.screen.UiElement;
import com.reelpilot.session.util.UsernameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Collects profile rows from followers/following lists or hashtag authors without engaging.
 * Enrichment visits each profile to read its counters and bio.
 */
public class ScraperWorkflow extends AbstractWorkflow {
    private static final Logger log = LoggerFactory.getLogger(ScraperWorkflow.class);

    static final int HASHTAG_MISSES_ALLOWED = 10;
    private static final Duration SETTLE = Duration.ofMillis(1500);

    private final Set<String> scraped = new HashSet<>();

    public ScraperWorkflow(WorkflowContext ctx) {
        super(ctx);
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.SCRAPER;
    }

    @Override
    protected void execute() {
        if (config.scrapeSource() == ScrapeSource.HASHTAG) {
            scrapeHashtag(config.hashtag());
        } else {
            ListKind kind = config.scrapeSource() == ScrapeSource.FOLLOWING ? ListKind.FOLLOWING : ListKind.FOLLOWERS;
            List<String> sources = sources();
            if (sources.isEmpty()) {
                stats.setErrorSummary("No accounts to scrape");
                stats.complete(CompletionReason.ERROR);
                return;
            }
            for (String source : sources) {
                if (!scrapeList(source, kind)) {
                    break;
                }
            }
        }
        if (limitReached()) {
            stats.complete(CompletionReason.MAX_PROFILES_REACHED);
        }
    }

    private List<String> sources() {
        List<String> sources = new ArrayList<>();
        for (String raw : config.targetUsernames()) {
            String username = UsernameRules.normalize(raw);
            if (UsernameRules.isValid(username) && !sources.contains(username)) {
                sources.add(username);
            }
        }
        String query = UsernameRules.normalize(config.searchQuery());
        if (sources.isEmpty() && UsernameRules.isValid(query)) {
            sources.add(query);
        }
        return sources;
    }

    /**
     * @return false when the whole run must end
     */
    boolean scrapeList(String source, ListKind kind) {
        String label = kind.name().toLowerCase(Locale.ROOT) + ":@" + source;
        Checkpoint checkpoint = new Checkpoint(PageState.FOLLOWERS_LIST, label, () -> ctx.navigator().openListOf(source, kind));
        if (!ctx.navigator().openProfileOf(source)) {
            log.warn("Could not open @{}, skipping", source);
            stats.increment(StatsCounter.ERRORS);
            return true;
        }
        Long total = kind == ListKind.FOLLOWERS ? ctx.reader().readFollowersCount() : null;
        if (!ctx.navigator().openList(kind)) {
            log.warn("Could not open {} list of @{}, skipping", kind, source);
            stats.increment(StatsCounter.ERRORS);
            return true;
        }

        Set<String> seenHere = new HashSet<>();
        int misses = 0;
        while (shouldContinue()) {
            if (limitReached()) {
                return false;
            }
            try {
                List<ListRow> rows = ctx.reader().visibleRows();
                Optional<ListRow> next = rows.stream().filter(row -> !seenHere.contains(row.username())).findFirst();
                if (next.isEmpty()) {
                    misses++;
                    if (misses > SmartScrollBudget.attempts(seenHere.size(), total)) {
                        log.info("Finished {} after {} rows", label, seenHere.size());
                        return true;
                    }
                    StuckCheck stuck = checkStuck(
                        FollowersWorkflow.signatureOf(rows),
                        () -> rescanList(FollowersWorkflow::signatureOf),
                        checkpoint
                    );
                    if (stuck == StuckCheck.FAILED) {
                        return false;
                    }
                    if (stuck == StuckCheck.RECOVERED) {
                        if (!reenterList(kind, checkpoint)) {
                            return false;
                        }
                        continue;
                    }
                    ctx.screen().scrollList();
                    ctx.sleeper().sleep(SETTLE);
                    continue;
                }
                misses = 0;
                ctx.stuckDetector().reset();
                ListRow row = next.get();
                seenHere.add(row.username());
                if (!scraped.add(row.username())) {
                    continue;
                }
                ScrapedProfile profile = ScrapedProfile.fromRow(row, label);
                if (config.enrichProfiles()) {
                    profile = enrichFromRow(row, profile);
                    if (!ctx.navigator().returnTo(PageState.FOLLOWERS_LIST, FollowersWorkflow.RETURN_ATTEMPTS)
                        && !hardRecover(checkpoint)) {
                        save(profile);
                        return false;
                    }
                }
                save(profile);
                ctx.pacing().delayBetweenActions();
            } catch (RuntimeException e) {
                if (!recordFailure("scraping " + label, e)) {
                    return false;
                }
            }
        }
        return false;
    }

    private ScrapedProfile enrichFromRow(ListRow row, ScrapedProfile profile) {
        ctx.screen().tap(row.centerX(), row.centerY());
        ctx.sleeper().sleep(SETTLE);
        PageState landed = ctx.detector().classify();
        if (landed == PageState.STORY) {
            if (!ctx.screen().click(UiElement.STORY_CLOSE)) {
                ctx.screen().pressSystemBack();
            }
            ctx.sleeper().sleep(SETTLE);
            landed = ctx.detector().classify();
        }
        if (landed != PageState.PROFILE) {
            log.debug("Could not enrich @{}, landed on {}", row.username(), landed);
            return profile;
        }
        return enrich(profile, ctx.reader().readProfile());
    }

    void scrapeHashtag(String hashtag) {
        String tag = hashtag == null ? "" : hashtag.trim().replaceFirst("^#", "");
        if (tag.isEmpty()) {
            stats.setErrorSummary("A hashtag is required");
            stats.complete(CompletionReason.ERROR);
            return;
        }
        if (!ctx.navigator().openHashtag(tag)) {
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        String label = "hashtag:#" + tag;
        int misses = 0;
        while (shouldContinue() && !limitReached()) {
            try {
                ctx.popups().dismissAll(stats);
                VideoDetails video = ctx.reader().readCurrentVideo().orElse(null);
                String author = video == null ? null : UsernameRules.normalize(video.author());
                if (!UsernameRules.isValid(author) || scraped.contains(author)) {
                    misses++;
                    if (misses > HASHTAG_MISSES_ALLOWED) {
                        log.info("No new authors for {} after {} videos", label, misses - 1);
                        stats.complete(CompletionReason.NO_MORE_TARGETS);
                        return;
                    }
                    ctx.screen().swipeToNextVideo();
                    continue;
                }
                misses = 0;
                scraped.add(author);
                ScrapedProfile profile = new ScrapedProfile(author, null, null, null, null, null, false, false, label, false, Instant.now());
                if (config.enrichProfiles() && ctx.screen().click(UiElement.AUTHOR_USERNAME)) {
                    ctx.sleeper().sleep(SETTLE);
                    if (ctx.detector().isOn(PageState.PROFILE)) {
                        profile = enrich(profile, ctx.reader().readProfile());
                    }
                    ctx.screen().back();
                    ctx.sleeper().sleep(SETTLE);
                }
                save(profile);
                ctx.screen().swipeToNextVideo();
                ctx.pacing().delayBetweenActions();
            } catch (RuntimeException e) {
                if (!recordFailure("scraping " + label, e)) {
                    return;
                }
            }
        }
    }

    private ScrapedProfile enrich(ScrapedProfile profile, ProfileSnapshot snapshot) {
        if (snapshot == null) {
            return profile;
        }
        stats.increment(StatsCounter.PROFILES_ENRICHED);
        return profile.enrichedWith(snapshot);
    }

    private void save(ScrapedProfile profile) {
        stats.increment(StatsCounter.PROFILES_SCRAPED);
        try {
            ctx.journal().saveProfile(sessionId(), profile);
        } catch (RuntimeException e) {
            log.warn("Unable to store scraped profile @{}", profile.username(), e);
            stats.increment(StatsCounter.ERRORS);
        }
    }

    private boolean limitReached() {
        return stats.get(StatsCounter.PROFILES_SCRAPED) >= config.maxTargets();
    }
}
