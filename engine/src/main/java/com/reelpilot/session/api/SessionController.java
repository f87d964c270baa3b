package com.reelpilot.session.api;

import com.reelpilot.config.SessionProperties;
import com.reelpilot.session.model.InteractionRecord;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScrapeSource;
import com.reelpilot.session.model.SessionRunStatus;
import com.reelpilot.session.model.WorkflowSessionView;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.persistence.JdbcInteractionLedger;
import com.reelpilot.session.persistence.SessionRunRepository;
import com.reelpilot.session.service.ScrapedProfileExportService;
import com.reelpilot.session.service.SessionRunService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionRunService sessionRunService;
    private final SessionProperties properties;
    private final SessionRunRepository sessionRunRepository;
    private final JdbcInteractionLedger interactionLedger;
    private final ScrapedProfileExportService exportService;

    public SessionController(
        SessionRunService sessionRunService,
        SessionProperties properties,
        SessionRunRepository sessionRunRepository,
        JdbcInteractionLedger interactionLedger,
        ScrapedProfileExportService exportService
    ) {
        this.sessionRunService = sessionRunService;
        this.properties = properties;
        this.sessionRunRepository = sessionRunRepository;
        this.interactionLedger = interactionLedger;
        this.exportService = exportService;
    }

    @PostMapping("/run")
    public SessionRunStatus run(@RequestBody SessionRunRequest request) {
        return sessionRunService.startAsync(toRunConfig(request));
    }

    @PostMapping("/stop")
    public SessionRunStatus stop() {
        return sessionRunService.stop();
    }

    @PostMapping("/pause")
    public SessionRunStatus pause() {
        return sessionRunService.pause();
    }

    @PostMapping("/resume")
    public SessionRunStatus resume() {
        return sessionRunService.resume();
    }

    @GetMapping("/status")
    public SessionRunStatus status() {
        return sessionRunService.status();
    }

    @GetMapping("/recent")
    public List<WorkflowSessionView> recent(
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return sessionRunRepository.findRecentSessions(limit);
    }

    @GetMapping("/interactions/recent")
    public List<InteractionRecord> recentInteractions(
        @RequestParam(name = "accountId", required = false) String accountId,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        String account = accountId == null || accountId.isBlank() ? properties.getAccountId() : accountId.trim();
        return interactionLedger.findRecentInteractions(account, limit);
    }

    @GetMapping("/{id}")
    public WorkflowSessionView session(@PathVariable("id") long id) {
        WorkflowSessionView view = sessionRunRepository.findSession(id);
        if (view == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown session " + id);
        }
        return view;
    }

    @GetMapping("/{id}/profiles.csv")
    public ResponseEntity<String> scrapedProfiles(@PathVariable("id") long id) {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"session-" + id + "-profiles.csv\"")
            .contentType(new MediaType("text", "csv"))
            .body(exportService.exportCsv(id));
    }

    RunConfig toRunConfig(SessionRunRequest request) {
        if (request == null || request.workflow() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "workflow is required");
        }
        WorkflowType type = WorkflowType.fromString(request.workflow());
        if (type == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unknown workflow: " + request.workflow());
        }
        if (type == WorkflowType.FOLLOWERS && isBlank(request.searchQuery())) {
            throw new ResponseStatusException(BAD_REQUEST, "searchQuery is required for the followers workflow");
        }
        if (type == WorkflowType.SEARCH && isBlank(request.searchQuery()) && isBlank(request.hashtag())) {
            throw new ResponseStatusException(BAD_REQUEST, "searchQuery or hashtag is required for the search workflow");
        }

        RunConfig.Builder builder = properties.newRunConfig(type);
        if (!isBlank(request.accountId())) {
            builder.accountId(request.accountId().trim());
        }
        builder.searchQuery(request.searchQuery())
            .hashtag(request.hashtag())
            .likeBounds(request.minLikes(), request.maxLikes())
            .seed(request.seed());
        if (request.targetUsernames() != null) {
            builder.targetUsernames(request.targetUsernames());
        }
        if (request.scrapeSource() != null) {
            try {
                builder.scrapeSource(ScrapeSource.fromString(request.scrapeSource()));
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(BAD_REQUEST, "Unknown scrapeSource: " + request.scrapeSource());
            }
        }
        if (request.enrichProfiles() != null) {
            builder.enrichProfiles(request.enrichProfiles());
        }
        if (request.maxTargets() != null) {
            builder.maxTargets(request.maxTargets());
        }
        if (request.likeProbability() != null) {
            builder.likeProbability(request.likeProbability());
        }
        if (request.followProbability() != null) {
            builder.followProbability(request.followProbability());
        }
        if (request.favoriteProbability() != null) {
            builder.favoriteProbability(request.favoriteProbability());
        }
        if (request.commentProbability() != null) {
            builder.commentProbability(request.commentProbability());
        }
        if (request.shareProbability() != null) {
            builder.shareProbability(request.shareProbability());
        }
        if (request.storyLikeProbability() != null) {
            builder.storyLikeProbability(request.storyLikeProbability());
        }
        if (request.maxLikesPerSession() != null) {
            builder.maxLikesPerSession(request.maxLikesPerSession());
        }
        if (request.maxFollowsPerSession() != null) {
            builder.maxFollowsPerSession(request.maxFollowsPerSession());
        }
        if (request.maxUnfollows() != null) {
            builder.maxUnfollows(request.maxUnfollows());
        }
        if (request.maxConversations() != null) {
            builder.maxConversations(request.maxConversations());
        }
        if (request.postsPerProfile() != null) {
            builder.postsPerProfile(request.postsPerProfile());
        }
        if (request.includeFriends() != null) {
            builder.includeFriends(request.includeFriends());
        }
        if (request.followBackSuggestions() != null) {
            builder.followBackSuggestions(request.followBackSuggestions());
        }
        if (request.requiredHashtags() != null) {
            builder.requiredHashtags(request.requiredHashtags());
        }
        if (request.excludedHashtags() != null) {
            builder.excludedHashtags(request.excludedHashtags());
        }
        if (request.commentTemplates() != null) {
            builder.commentTemplates(request.commentTemplates());
        }
        if (request.messageTemplates() != null) {
            builder.messageTemplates(request.messageTemplates());
        }
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
