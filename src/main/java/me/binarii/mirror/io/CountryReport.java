package me.binarii.mirror.io;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class CountryReport {

    private static final String HEADER = "Country";

    private static final Comparator<Map.Entry<String, String>> BY_COUNTRY_AND_CODE =
            Map.Entry.<String, String>comparingByKey().thenComparing(Map.Entry.<String, String>comparingByValue());

    public String render(MirrorList mirrorList) {
        Map<Map.Entry<String, String>, Integer> counts = new TreeMap<>(BY_COUNTRY_AND_CODE);
        for (Mirror mirror : mirrorList.getMirrors()) {
            if (mirror.getCountry() == null || mirror.getCountryCode() == null) {
                continue;
            }
            counts.merge(Map.entry(mirror.getCountry(), mirror.getCountryCode()), 1, Integer::sum);
        }

        int width = HEADER.length();
        for (Map.Entry<String, String> key : counts.keySet()) {
            width = Math.max(width, length(key.getKey()));
        }

        List<String> lines = new ArrayList<>();
        lines.add(HEADER + pad(width - HEADER.length()) + " Code Count");
        lines.add("-".repeat(width) + " ---- ----");
        for (Map.Entry<Map.Entry<String, String>, Integer> entry : counts.entrySet()) {
            String country = entry.getKey().getKey();
            if (country.isEmpty()) {
                continue;
            }
            lines.add(String.format("%s%s %4s %4d",
                    country, pad(width - length(country)), entry.getKey().getValue(), entry.getValue()));
        }
        return String.join("\n", lines);
    }

    private static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    private static String pad(int width) {
        return " ".repeat(Math.max(0, width));
    }

}
