package com.autopost.scheduler.client;

import java.nio.file.Path;
import java.util.List;

/**
 * Logged-in session of one account on the publishing platform.
 */
public interface PublishingClient {

    MediaHandle publishSingle(Path photo, String caption);

    MediaHandle publishAlbum(List<Path> items, String caption);

    MediaHandle publishVideo(Path video, String caption);
}
