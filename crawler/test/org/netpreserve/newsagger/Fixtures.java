package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

public class Fixtures {
    public static final String BASE = "https://chroniclingamerica.loc.gov";

    public static Page page(String lccn, String date, int sequence) {
        String itemId = "/lccn/" + lccn + "/" + date + "/ed-1/seq-" + sequence + "/";
        String url = BASE + itemId.substring(0, itemId.length() - 1);
        return new Page(itemId, lccn, "Test title", date, 1, sequence, url + ".json", url + ".pdf", url + ".jp2",
                "page " + sequence + " text", 3, false, null);
    }

    public static Periodical periodical(String lccn, @Nullable String state) {
        return Periodical.discovered(lccn, "Title " + lccn, state, null, 1890, 1922, "Daily", "English", null,
                BASE + "/lccn/" + lccn + ".json");
    }
}
