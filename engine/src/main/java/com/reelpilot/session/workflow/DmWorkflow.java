package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.InboxConversation;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.screen.UiElement;
import com.reelpilot.session.util.UsernameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Direct messages. With recipients configured, each one not messaged within the cooldown window
 * gets one templated message through the Message button of their profile. Without recipients,
 * the inbox is read thread by thread and, when templates are configured, every one-to-one
 * thread gets one reply.
 */
public class DmWorkflow extends AbstractWorkflow {
    private static final Logger log = LoggerFactory.getLogger(DmWorkflow.class);

    static final int EMPTY_INBOX_SCROLLS = 3;
    static final Set<String> SYSTEM_THREADS = Set.of("new followers", "activity", "system notifications");
    private static final Duration SETTLE = Duration.ofMillis(1500);

    private final Random random;
    private final Checkpoint inboxCheckpoint;

    public DmWorkflow(WorkflowContext ctx) {
        super(ctx);
        this.random = config.seed() == null ? new Random() : new Random(config.seed());
        this.inboxCheckpoint = new Checkpoint(PageState.INBOX, "inbox", ctx.navigator()::openInbox);
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.DM;
    }

    @Override
    protected void execute() {
        List<String> recipients = recipients();
        if (!recipients.isEmpty()) {
            if (config.messageTemplates().isEmpty()) {
                stats.setErrorSummary("Message templates are required to message recipients");
                stats.complete(CompletionReason.ERROR);
                return;
            }
            outreach(recipients);
        } else {
            readInbox();
        }
    }

    private List<String> recipients() {
        List<String> recipients = new ArrayList<>();
        for (String raw : config.targetUsernames()) {
            String username = UsernameRules.normalize(raw);
            if (UsernameRules.isValid(username) && !recipients.contains(username)) {
                recipients.add(username);
            }
        }
        return recipients;
    }

    void outreach(List<String> recipients) {
        for (String recipient : recipients) {
            if (!shouldContinue() || capReached(StatsCounter.MESSAGES_SENT)) {
                return;
            }
            try {
                if (messageRecipient(recipient)) {
                    ctx.navigator().ensureFeed();
                }
            } catch (RuntimeException e) {
                if (!recordFailure("messaging @" + recipient, e)) {
                    return;
                }
                ctx.navigator().ensureFeed();
            }
        }
        capReached(StatsCounter.MESSAGES_SENT);
    }

    /**
     * @return true when the screen was navigated away and has to be brought back home
     */
    private boolean messageRecipient(String recipient) {
        if (ctx.ledger().hasRecent(recipient, InteractionKind.DM)) {
            log.debug("@{} was messaged recently, skipping", recipient);
            stats.increment(StatsCounter.SKIPPED);
            return false;
        }
        ctx.popups().dismissAll(stats);
        if (!ctx.navigator().openProfileOf(recipient)) {
            log.warn("Could not open profile of @{}", recipient);
            stats.increment(StatsCounter.ERRORS);
            ctx.events().action(InteractionKind.DM.code(), recipient, false);
            return true;
        }
        if (!ctx.screen().click(UiElement.PROFILE_MESSAGE_BUTTON)) {
            log.warn("No Message button on the profile of @{}", recipient);
            ctx.events().action(InteractionKind.DM.code(), recipient, false);
            return true;
        }
        ctx.sleeper().sleep(SETTLE);
        sendMessage(recipient);
        return true;
    }

    void readInbox() {
        if (!ctx.navigator().openInbox() && !hardRecover(inboxCheckpoint)) {
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        Set<String> seen = new HashSet<>();
        int emptyScrolls = 0;
        while (shouldContinue() && !capReached(StatsCounter.CONVERSATIONS_READ)) {
            try {
                ctx.popups().dismissAll(stats);
                Optional<InboxConversation> next = ctx.reader().inboxConversations().stream()
                    .filter(conversation -> !seen.contains(key(conversation.name())))
                    .findFirst();
                if (next.isEmpty()) {
                    emptyScrolls++;
                    if (emptyScrolls >= EMPTY_INBOX_SCROLLS) {
                        log.info("No new conversations after {} scrolls", emptyScrolls);
                        stats.complete(CompletionReason.NO_MORE_TARGETS);
                        return;
                    }
                    ctx.screen().scrollList();
                    ctx.sleeper().sleep(SETTLE);
                    continue;
                }
                emptyScrolls = 0;
                InboxConversation conversation = next.get();
                seen.add(key(conversation.name()));
                if (SYSTEM_THREADS.contains(key(conversation.name()))) {
                    stats.increment(StatsCounter.SKIPPED);
                    continue;
                }
                openConversation(conversation);
                if (!backToInbox()) {
                    return;
                }
            } catch (RuntimeException e) {
                if (!recordFailure("reading the inbox", e) || !backToInbox()) {
                    return;
                }
            }
        }
    }

    private void openConversation(InboxConversation conversation) {
        ctx.screen().tap(conversation.centerX(), conversation.centerY());
        ctx.sleeper().sleep(SETTLE);
        if (ctx.screen().isPresent(UiElement.CONVERSATION_GROUP_MEMBERS)) {
            log.debug("Skipping group thread '{}'", conversation.name());
            stats.increment(StatsCounter.GROUPS_SKIPPED);
            return;
        }
        stats.increment(StatsCounter.CONVERSATIONS_READ);
        if (config.messageTemplates().isEmpty()) {
            return;
        }
        String recipient = UsernameRules.normalize(conversation.name());
        if (ctx.ledger().hasRecent(recipient, InteractionKind.DM)) {
            stats.increment(StatsCounter.SKIPPED);
            return;
        }
        sendMessage(recipient);
    }

    /**
     * Sends one template into the open conversation and records the outcome in the ledger.
     */
    private void sendMessage(String recipient) {
        if (ctx.screen().isPresent(UiElement.MESSAGE_BLOCKED)) {
            log.info("@{} does not accept messages", recipient);
            stats.increment(StatsCounter.PRIVACY_BLOCKED);
            ctx.ledger().record(recipient, InteractionKind.DM, false, sessionId());
            ctx.events().action(InteractionKind.DM.code(), recipient, false);
            return;
        }
        String message = config.messageTemplates().get(random.nextInt(config.messageTemplates().size()));
        boolean sent = ctx.screen().click(UiElement.MESSAGE_INPUT)
            && ctx.screen().typeText(message)
            && ctx.screen().click(UiElement.MESSAGE_SEND);
        ctx.ledger().record(recipient, InteractionKind.DM, sent, sessionId());
        ctx.events().action(InteractionKind.DM.code(), recipient, sent);
        if (sent) {
            stats.increment(StatsCounter.MESSAGES_SENT);
            ctx.pacing().noteAction();
        } else {
            log.warn("Message to @{} was not sent", recipient);
        }
        ctx.pacing().delayBetweenActions();
        ctx.pacing().maybePause();
    }

    private boolean backToInbox() {
        if (ctx.navigator().returnTo(PageState.INBOX, FollowersWorkflow.RETURN_ATTEMPTS)) {
            return true;
        }
        return hardRecover(inboxCheckpoint);
    }

    private boolean capReached(StatsCounter counter) {
        if (stats.get(counter) >= config.maxConversations()) {
            stats.complete(CompletionReason.MAX_CONVERSATIONS_REACHED);
            return true;
        }
        return false;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
