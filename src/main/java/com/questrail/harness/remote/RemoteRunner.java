package com.questrail.harness.remote;

import com.questrail.harness.api.TestLifecycle;
import com.questrail.harness.api.TestListener;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.bus.BusValues;
import com.questrail.harness.bus.ExportedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * RemoteRunner
 * =============================================================================
 * The object a worker process exports first. It turns a
 * {@code createTestInstance(location, moduleName, className, arguments)} call
 * into a live {@link RemoteTest} exported on the bus.
 *
 * <h2>Class lookup</h2>
 * {@code moduleName.className} is resolved with the worker's class loader
 * first; if that fails and a location (directory, jar or URL) is given, a
 * dedicated class loader over that location is tried.
 *
 * <p>A worker hosts one test. When it is done the runner calls its
 * {@code onFinished} callback, which normally ends the worker process.</p>
 */
public final class RemoteRunner
{
    private static final Logger log = LoggerFactory.getLogger(RemoteRunner.class);

    private final WorkerSession session;
    private final Runnable onFinished;

    private RemoteTest instance;
    private URLClassLoader locationLoader;

    public RemoteRunner(WorkerSession session, Runnable onFinished)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
    }

    public void export()
    {
        session.bus().exportObject(BusNames.runnerObjectPath(session.uuid()),
                ExportedObject.builder(BusNames.RUNNER_INTERFACE)
                        .method(BusNames.CREATE_TEST_INSTANCE, args -> createTestInstance(
                                BusValues.stringArg(args, 0),
                                BusValues.stringArg(args, 1),
                                BusValues.stringArg(args, 2),
                                BusValues.mapArg(args, 3)))
                        .build());
    }

    /**
     * @return {@code false} if the class cannot be found, is not a
     *         {@link RemoteTest}, cannot be constructed, or a test already exists
     */
    public boolean createTestInstance(String location, String moduleName, String className, Map<String, Object> arguments)
    {
        if (instance != null) {
            log.warn("Worker {} already hosts {}", session.uuid(), instance.getClass().getName());
            return false;
        }
        if (className == null || className.isEmpty()) {
            log.error("Worker {}: no class name given", session.uuid());
            return false;
        }

        String qualifiedName = moduleName == null || moduleName.isEmpty() ? className : moduleName + "." + className;
        try {
            Class<?> cls = loadClass(location, qualifiedName);
            if (!RemoteTest.class.isAssignableFrom(cls)) {
                log.error("Worker {}: {} is not a RemoteTest", session.uuid(), qualifiedName);
                return false;
            }

            Constructor<? extends RemoteTest> ctor = cls.asSubclass(RemoteTest.class)
                    .getConstructor(WorkerSession.class, Map.class);
            RemoteTest test = ctor.newInstance(session, arguments == null ? Map.of() : arguments);
            test.addListener(new TestListener() {
                @Override
                public void onDone(TestLifecycle t) {
                    finished();
                }
            });
            test.export();
            instance = test;
            log.info("Worker {}: created {}", session.uuid(), qualifiedName);
            return true;
        } catch (ReflectiveOperationException | IOException | IllegalArgumentException e) {
            log.error("Worker {}: could not create {}", session.uuid(), qualifiedName, e);
            return false;
        }
    }

    private Class<?> loadClass(String location, String qualifiedName) throws ClassNotFoundException, MalformedURLException
    {
        ClassLoader parent = RemoteRunner.class.getClassLoader();
        try {
            return Class.forName(qualifiedName, true, parent);
        } catch (ClassNotFoundException e) {
            if (location == null || location.isEmpty()) {
                throw e;
            }
            log.debug("Worker {}: {} not on classpath, trying {}", session.uuid(), qualifiedName, location);
            locationLoader = new URLClassLoader(new URL[] { toUrl(location) }, parent);
            return Class.forName(qualifiedName, true, locationLoader);
        }
    }

    private static URL toUrl(String location) throws MalformedURLException
    {
        URI uri = URI.create(location);
        if (uri.isAbsolute()) {
            return uri.toURL();
        }
        return Path.of(location).toUri().toURL();
    }

    private void finished()
    {
        URLClassLoader loader = locationLoader;
        locationLoader = null;
        if (loader != null) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Worker {}: could not close class loader", session.uuid(), e);
            }
        }
        onFinished.run();
    }
}
