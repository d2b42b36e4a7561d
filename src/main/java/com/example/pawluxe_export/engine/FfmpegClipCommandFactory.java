package com.example.pawluxe_export.engine;

import com.example.pawluxe_export.selector.Excerpt;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FfmpegClipCommandFactory implements ClipCommandFactory {
    private final String ffmpegBin;
    private final String preset;
    private final int crf;

    public FfmpegClipCommandFactory(String ffmpegBin, String preset, int crf) {
        this.ffmpegBin = ffmpegBin;
        this.preset = preset;
        this.crf = crf;
    }

    @Override
    public List<String> trim(Excerpt excerpt, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-ss");      cmd.add(String.format(Locale.ROOT, "%.3f", excerpt.offsetSeconds()));
        cmd.add("-i");       cmd.add(excerpt.segmentPath());
        cmd.add("-t");       cmd.add(String.format(Locale.ROOT, "%.3f", excerpt.durationSeconds()));
        cmd.add("-an");
        cmd.add("-c:v");     cmd.add("libx264");
        cmd.add("-preset");  cmd.add(preset);
        cmd.add("-crf");     cmd.add(String.valueOf(crf));
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    @Override
    public List<String> concat(Path listFile, Path output) {
        return List.of(
                ffmpegBin, "-y",
                "-f", "concat",
                "-safe", "0",
                "-i", listFile.toAbsolutePath().toString(),
                "-c", "copy",
                "-movflags", "+faststart",
                output.toAbsolutePath().toString()
        );
    }
}
