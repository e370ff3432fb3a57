package ca.gc.cra.scribe.application.component.fixtures;

import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.domain.component.ScribeComponent;

@ScribeComponent(type = ComponentType.VIEW, id = "abstractPanel")
public abstract class AbstractPanel {
}
