package com.reelpilot.session.service;

import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.persistence.ScrapedProfileRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringWriter;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapedProfileExportServiceTest {

    @Mock
    private ScrapedProfileRepository repository;

    @Test
    void writesHeaderAndQuotesFreeText() throws Exception {
        ScrapedProfileExportService service = new ScrapedProfileExportService(repository);
        ScrapedProfile profile = new ScrapedProfile(
            "alice", "Alice, Cat Person", 1200L, 80L, null, "likes \"cats\"",
            false, true, "followers:@bob", true, Instant.parse("2026-01-02T03:04:05Z")
        );
        StringWriter out = new StringWriter();

        service.write(List.of(profile), out);

        String[] lines = out.toString().split("\r\n");
        assertEquals("username,display_name,followers,following,likes,bio,private,verified,source,enriched,scraped_at", lines[0]);
        assertEquals(
            "alice,\"Alice, Cat Person\",1200,80,,\"likes \"\"cats\"\"\",false,true,followers:@bob,true,2026-01-02T03:04:05Z",
            lines[1]
        );
    }

    @Test
    void exportReadsProfilesOfOneSession() {
        when(repository.findBySession(7L)).thenReturn(List.of());

        String csv = new ScrapedProfileExportService(repository).exportCsv(7L);

        assertThat(csv).startsWith("username,display_name");
        assertThat(csv.split("\r\n")).hasSize(1);
    }
}
