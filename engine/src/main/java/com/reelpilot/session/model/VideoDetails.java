package com.reelpilot.session.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record VideoDetails(
    String author,
    String description,
    String likeCountText,
    Long likeCount,
    boolean liked,
    boolean favorited,
    boolean advertisement
) {
    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_]+)");

    public Set<String> hashtags() {
        Set<String> tags = new LinkedHashSet<>();
        if (description == null) {
            return tags;
        }
        Matcher matcher = HASHTAG.matcher(description);
        while (matcher.find()) {
            tags.add(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return tags;
    }
}
