package ca.gc.cra.scribe.application.component.fixtures;

import ca.gc.cra.scribe.application.component.ResolvedDependencies;
import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.domain.component.ScribeComponent;

@ScribeComponent(
    type = ComponentType.VIEW,
    id = "recentFilesView",
    version = "2.0.0",
    dependencies = {"recentFiles"},
    parent = "recentFiles")
public class RecentFilesView {
  private final RecentFilesService service;

  public RecentFilesView(ResolvedDependencies dependencies) {
    this.service = dependencies.dependency("recentFiles", RecentFilesService.class);
  }

  public RecentFilesService service() {
    return service;
  }
}
