package com.reelpilot.session.service;

import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.persistence.ScrapedProfileRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

@Service
public class ScrapedProfileExportService {
    static final String[] HEADER = {
        "username", "display_name", "followers", "following", "likes", "bio",
        "private", "verified", "source", "enriched", "scraped_at"
    };

    private final ScrapedProfileRepository repository;

    public ScrapedProfileExportService(ScrapedProfileRepository repository) {
        this.repository = repository;
    }

    public String exportCsv(long sessionId) {
        StringWriter writer = new StringWriter();
        try {
            write(repository.findBySession(sessionId), writer);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to render CSV for session " + sessionId, e);
        }
        return writer.toString();
    }

    void write(List<ScrapedProfile> profiles, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (ScrapedProfile profile : profiles) {
                printer.printRecord(
                    profile.username(),
                    profile.displayName(),
                    profile.followersCount(),
                    profile.followingCount(),
                    profile.likesCount(),
                    profile.bio(),
                    profile.privateAccount(),
                    profile.verified(),
                    profile.source(),
                    profile.enriched(),
                    profile.scrapedAt()
                );
            }
        }
    }
}
