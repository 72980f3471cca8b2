package com.gentoro.autotag.batch;

import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import java.nio.file.Path;
import java.util.Objects;

/** Parameters of one batch run. */
public record BatchRequest(Path folder, boolean recursive, SaveMode saveMode, TagMode tagMode) {

  public BatchRequest {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(saveMode, "saveMode");
    Objects.requireNonNull(tagMode, "tagMode");
  }
}
