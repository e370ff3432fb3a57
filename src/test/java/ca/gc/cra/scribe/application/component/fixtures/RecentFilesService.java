package ca.gc.cra.scribe.application.component.fixtures;

import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.domain.component.ScribeComponent;

@ScribeComponent(
    type = ComponentType.SERVICE,
    id = "recentFiles",
    name = "Recent files",
    description = "Tracks recently opened documents",
    tags = {"core", "files"})
public class RecentFilesService {
}
