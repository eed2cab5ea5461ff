package me.binarii.mirror.io;

import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

public class MirrorListWriter {

    static final String BANNER = "# Arch Linux mirror list generated by mirror-ranker";

    public String render(MirrorList mirrorList, int number) {
        List<String> lines = new ArrayList<>();
        lines.add(BANNER);
        lines.add("#");
        if (mirrorList.getSource() != null) {
            lines.add("# from: \t" + mirrorList.getSource());
        }
        lines.add("");
        for (Mirror mirror : mirrorList.truncate(number).getMirrors()) {
            lines.add("Server = " + mirror.getUrl() + "$repo/os/$arch");
        }
        return String.join("\n", lines);
    }

    public void write(MirrorList mirrorList, int number, Path file) throws IOException {
        Files.write(file, (render(mirrorList, number) + "\n").getBytes(UTF_8));
    }

}
