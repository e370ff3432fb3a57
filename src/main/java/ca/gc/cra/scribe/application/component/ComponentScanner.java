package ca.gc.cra.scribe.application.component;

import ca.gc.cra.scribe.domain.component.ScribeComponent;
import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds {@link ScribeComponent}-annotated classes under a directory of compiled classes.
 *
 * <p>Each root gets a {@link URLClassLoader} that delegates to the registry's own loader first, so
 * classes already on the application class path keep their identity. Loaders stay open until
 * {@link #close()} because discovered classes may load further classes lazily.</p>
 */
final class ComponentScanner implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ComponentScanner.class);
  private static final String CLASS_SUFFIX = ".class";

  private final ClassLoader parent;
  private final List<URLClassLoader> loaders = new ArrayList<>();

  ComponentScanner(ClassLoader parent) {
    this.parent = parent;
  }

  /**
   * Scans {@code root} for annotated, concrete classes.
   *
   * @param root class-path root directory
   * @param packagePrefix package to restrict the scan to; empty for the whole root
   * @return annotated classes in path order
   * @throws IOException when the directory cannot be walked
   */
  List<Class<?>> scan(Path root, String packagePrefix) throws IOException {
    Path start = packagePrefix.isEmpty()
        ? root
        : root.resolve(packagePrefix.replace('.', '/'));
    if (!Files.isDirectory(start)) {
      log.warn("Discovery path does not exist: {}", start);
      return List.of();
    }

    List<Path> classFiles;
    try (Stream<Path> files = Files.walk(start)) {
      classFiles = files
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(CLASS_SUFFIX))
          .filter(path -> !path.getFileName().toString().contains("-info"))
          .sorted()
          .collect(Collectors.toList());
    }

    ClassLoader loader = loaderFor(root);
    List<Class<?>> found = new ArrayList<>();
    for (Path file : classFiles) {
      String className = binaryName(root, file);
      Class<?> type;
      try {
        type = Class.forName(className, false, loader);
      } catch (ClassNotFoundException | LinkageError ex) {
        log.error("Error loading class {} during component discovery", className, ex);
        continue;
      }
      if (isComponent(type)) {
        found.add(type);
      }
    }
    log.debug("Scanned {} class files under {}, found {} components", classFiles.size(), start, found.size());
    return found;
  }

  @Override
  public void close() {
    for (URLClassLoader loader : loaders) {
      try {
        loader.close();
      } catch (IOException ex) {
        log.warn("Failed to close discovery class loader", ex);
      }
    }
    loaders.clear();
  }

  private ClassLoader loaderFor(Path root) throws MalformedURLException {
    URLClassLoader loader =
        new URLClassLoader(new URL[] {root.toAbsolutePath().toUri().toURL()}, parent);
    loaders.add(loader);
    return loader;
  }

  private static boolean isComponent(Class<?> type) {
    int modifiers = type.getModifiers();
    return type.isAnnotationPresent(ScribeComponent.class)
        && !type.isInterface()
        && !Modifier.isAbstract(modifiers);
  }

  private static String binaryName(Path root, Path classFile) {
    Path relative = root.relativize(classFile);
    StringBuilder name = new StringBuilder();
    for (Path segment : relative) {
      if (name.length() > 0) {
        name.append('.');
      }
      name.append(segment.toString());
    }
    return name.substring(0, name.length() - CLASS_SUFFIX.length());
  }
}
