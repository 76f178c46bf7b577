package com.ttennebkram.imagelab.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Finds the operation classes in this package at runtime, from a class
 * directory (IDE, tests) or from a jar.
 *
 * A class is picked up when its simple name ends in "Operation", it is a
 * concrete top-level {@link ImageOperation} and it carries {@link OperationInfo}.
 */
public final class OperationScanner {

    private static final Logger logger = LoggerFactory.getLogger(OperationScanner.class);

    private static final String OPERATIONS_PACKAGE = OperationScanner.class.getPackage().getName();
    private static final String CLASS_SUFFIX = "Operation.class";

    private OperationScanner() {
    }

    /**
     * Operation classes ordered by class name.
     */
    public static Set<Class<? extends ImageOperation>> findOperationClasses() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = OperationScanner.class.getClassLoader();
        }

        Set<String> candidates = new TreeSet<>();
        String path = OPERATIONS_PACKAGE.replace('.', '/');
        try {
            Enumeration<URL> resources = classLoader.getResources(path);
            while (resources.hasMoreElements()) {
                URL resource = resources.nextElement();
                switch (resource.getProtocol()) {
                    case "file":
                        collectFromDirectory(new File(resource.toURI()), OPERATIONS_PACKAGE, candidates);
                        break;
                    case "jar":
                        collectFromJar(resource, path, candidates);
                        break;
                    default:
                        logger.warn("Cannot scan {} for operations", resource);
                }
            }
        } catch (IOException | URISyntaxException e) {
            logger.error("Error scanning for operation classes: {}", e.getMessage(), e);
        }

        Set<Class<? extends ImageOperation>> operationClasses = new LinkedHashSet<>();
        for (String className : candidates) {
            Class<? extends ImageOperation> operationClass = loadOperationClass(className, classLoader);
            if (operationClass != null) {
                operationClasses.add(operationClass);
            }
        }
        logger.debug("Discovered {} operation classes among {} candidates", operationClasses.size(), candidates.size());
        return operationClasses;
    }

    private static void collectFromDirectory(File directory, String packageName, Set<String> candidates) {
        File[] files = directory.listFiles();
        if (files == null) {
            return;
        }
        for (File file : files) {
            String name = file.getName();
            if (file.isDirectory()) {
                collectFromDirectory(file, packageName + "." + name, candidates);
            } else if (isCandidate(name)) {
                candidates.add(packageName + "." + name.substring(0, name.length() - ".class".length()));
            }
        }
    }

    private static void collectFromJar(URL jarUrl, String packagePath, Set<String> candidates)
            throws IOException, URISyntaxException {
        // jar:file:/path/to.jar!/com/...
        String spec = jarUrl.getPath();
        int bang = spec.indexOf('!');
        if (bang < 0) {
            return;
        }
        File jar = new File(new URL(spec.substring(0, bang)).toURI());
        try (JarFile jarFile = new JarFile(jar)) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                String entry = entries.nextElement().getName();
                String fileName = entry.substring(entry.lastIndexOf('/') + 1);
                if (entry.startsWith(packagePath + "/") && isCandidate(fileName)) {
                    candidates.add(entry.substring(0, entry.length() - ".class".length()).replace('/', '.'));
                }
            }
        }
    }

    /**
     * Top-level classes only; nested and anonymous classes contain '$'.
     */
    private static boolean isCandidate(String fileName) {
        return fileName.endsWith(CLASS_SUFFIX) && fileName.indexOf('$') < 0;
    }

    private static Class<? extends ImageOperation> loadOperationClass(String className, ClassLoader classLoader) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            logger.debug("Skipping {}: {}", className, e.getMessage());
            return null;
        }
        if (!ImageOperation.class.isAssignableFrom(clazz)
                || clazz.isInterface()
                || Modifier.isAbstract(clazz.getModifiers())
                || !clazz.isAnnotationPresent(OperationInfo.class)) {
            return null;
        }
        return clazz.asSubclass(ImageOperation.class);
    }
}
