package com.ttennebkram.imagelab.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Scans the classpath to discover all ImageOperation classes annotated with
 * {@link OperationInfo}.
 * Works from both the filesystem (IDE, Maven test runs) and a JAR.
 */
public class OperationScanner {

    private static final Logger log = LoggerFactory.getLogger(OperationScanner.class);

    private static final String OPERATIONS_PACKAGE = "com.ttennebkram.imagelab.operations";
    private static final String CLASS_SUFFIX = "Operation.class";

    private OperationScanner() {
    }

    /**
     * Find all concrete operation classes annotated with @OperationInfo.
     *
     * @return set of discovered operation classes
     * @throws IllegalStateException if the classpath cannot be read
     */
    public static Set<Class<? extends ImageOperation>> findOperationClasses() {
        Set<Class<? extends ImageOperation>> operationClasses = new LinkedHashSet<>();
        String path = OPERATIONS_PACKAGE.replace('.', '/');
        ClassLoader classLoader = OperationScanner.class.getClassLoader();

        try {
            Enumeration<URL> resources = classLoader.getResources(path);
            while (resources.hasMoreElements()) {
                URL resource = resources.nextElement();
                String protocol = resource.getProtocol();

                if ("file".equals(protocol)) {
                    scanDirectory(new File(resource.toURI()), OPERATIONS_PACKAGE, operationClasses);
                } else if ("jar".equals(protocol)) {
                    scanJar(resource, path, operationClasses);
                } else {
                    log.warn("Skipping operations on unsupported classpath protocol: {}", resource);
                }
            }
        } catch (IOException | URISyntaxException e) {
            throw new IllegalStateException("Could not scan classpath for operations", e);
        }

        return operationClasses;
    }

    private static void scanDirectory(File directory, String packageName,
                                      Set<Class<? extends ImageOperation>> result) {
        if (!directory.exists()) return;

        File[] files = directory.listFiles();
        if (files == null) return;

        for (File file : files) {
            if (file.isDirectory()) {
                scanDirectory(file, packageName + "." + file.getName(), result);
            } else if (file.getName().endsWith(CLASS_SUFFIX)) {
                String className = packageName + "." + file.getName().replace(".class", "");
                tryLoadOperationClass(className, result);
            }
        }
    }

    private static void scanJar(URL jarUrl, String packagePath,
                                Set<Class<? extends ImageOperation>> result)
            throws IOException, URISyntaxException {
        // URL looks like "jar:file:/path/to.jar!/com/..."
        String urlPath = jarUrl.getPath();
        int bangIndex = urlPath.indexOf('!');
        if (bangIndex < 0) return;

        String jarPath = urlPath.substring(0, bangIndex);
        if (jarPath.startsWith("file:")) {
            jarPath = new URI(jarPath).getPath();
        }

        try (JarFile jarFile = new JarFile(jarPath)) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                String name = entries.nextElement().getName();
                if (name.startsWith(packagePath) && name.endsWith(CLASS_SUFFIX)) {
                    String className = name.replace('/', '.').replace(".class", "");
                    tryLoadOperationClass(className, result);
                }
            }
        }
    }

    /**
     * Load a class and add it to the result if it is a concrete, annotated operation.
     */
    private static void tryLoadOperationClass(String className,
                                              Set<Class<? extends ImageOperation>> result) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className, true, OperationScanner.class.getClassLoader());
        } catch (ClassNotFoundException | NoClassDefFoundError e) {
            log.warn("Skipping operation class {}: {}", className, e.toString());
            return;
        }

        if (!ImageOperation.class.isAssignableFrom(clazz)) return;
        if (Modifier.isAbstract(clazz.getModifiers()) || clazz.isInterface()) return;
        if (!clazz.isAnnotationPresent(OperationInfo.class)) return;

        @SuppressWarnings("unchecked")
        Class<? extends ImageOperation> operationClass = (Class<? extends ImageOperation>) clazz;
        result.add(operationClass);
    }
}
