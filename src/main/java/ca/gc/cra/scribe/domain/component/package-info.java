/**
 * Component roles, scopes, lifecycle states, capability interfaces and the {@code @ScribeComponent}
 * discovery annotation.
 * <p><strong>Role:</strong> Domain layer shared by components and the registry.</p>
 */
package ca.gc.cra.scribe.domain.component;
