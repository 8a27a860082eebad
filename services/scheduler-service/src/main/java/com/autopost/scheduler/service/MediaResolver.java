package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.HardPublishFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a post's media file names to files on disk, looking in the photos directory
 * first and the videos directory second.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MediaResolver {

    private final AutopostProperties properties;

    public List<Path> resolve(List<String> media) {
        if (media == null || media.isEmpty()) {
            throw new HardPublishFailureException("Post has no media files");
        }
        Path photos = Path.of(properties.getMedia().getPhotosDir());
        Path videos = Path.of(properties.getMedia().getVideosDir());

        List<Path> paths = new ArrayList<>();
        for (String name : media) {
            Path photo = photos.resolve(name);
            Path video = videos.resolve(name);
            if (Files.isRegularFile(photo)) {
                paths.add(photo);
            } else if (Files.isRegularFile(video)) {
                paths.add(video);
            } else {
                throw new HardPublishFailureException("Media file not found: " + name);
            }
        }
        log.debug("Resolved media {} to {}", media, paths);
        return paths;
    }

    public boolean isVideo(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return properties.getMedia().getVideoExtensions().stream()
                .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }
}
