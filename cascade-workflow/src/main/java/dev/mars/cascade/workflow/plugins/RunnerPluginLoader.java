package dev.mars.cascade.workflow.plugins;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.cascade.config.CascadeConfiguration;
import dev.mars.cascade.runner.ActionRunnerProvider;
import dev.mars.cascade.runner.ActionRunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.TreeSet;

/**
 * Populates an {@link ActionRunnerRegistry} from {@link ActionRunnerProvider} services: first
 * those on the application classpath (including the bundled runners), then those in each
 * {@code *.jar} of the configured runners directory. Jars are scanned in name order; a later
 * provider registering an existing kind replaces it.
 *
 * <p>A jar or provider that fails to load is logged and skipped. The jar class loaders stay
 * open until {@link #close()} since runners are instantiated lazily.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public class RunnerPluginLoader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(RunnerPluginLoader.class);

    private final CascadeConfiguration configuration;
    private final ClassLoader parentClassLoader;
    private final List<URLClassLoader> jarLoaders = new ArrayList<>();
    private final List<String> loadedProviders = new ArrayList<>();

    public RunnerPluginLoader(CascadeConfiguration configuration) {
        this(configuration, RunnerPluginLoader.class.getClassLoader());
    }

    public RunnerPluginLoader(CascadeConfiguration configuration, ClassLoader parentClassLoader) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.parentClassLoader = Objects.requireNonNull(parentClassLoader, "Class loader cannot be null");
    }

    public ActionRunnerRegistry createRegistry() {
        ActionRunnerRegistry registry = new ActionRunnerRegistry();
        loadInto(registry);
        return registry;
    }

    public void loadInto(ActionRunnerRegistry registry) {
        int fromClasspath = install(ServiceLoader.load(ActionRunnerProvider.class, parentClassLoader), null, registry);
        logger.debug("Installed {} runner provider(s) from the classpath", fromClasspath);

        configuration.getRunnersDirectory().ifPresent(directory -> loadDirectory(directory, registry));
        logger.info("Available runner kinds: {}", registry.getKinds());
    }

    /**
     * Names of the providers installed so far, in installation order.
     */
    public List<String> getLoadedProviders() {
        return Collections.unmodifiableList(loadedProviders);
    }

    private void loadDirectory(Path directory, ActionRunnerRegistry registry) {
        if (!Files.isDirectory(directory)) {
            logger.warn("Runners directory does not exist: {}", directory);
            return;
        }
        TreeSet<Path> jars = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar);
            }
        } catch (IOException e) {
            logger.warn("Failed to list runners directory {}: {}", directory, e.getMessage());
            return;
        }
        for (Path jar : jars) {
            loadJar(jar, registry);
        }
    }

    private void loadJar(Path jar, ActionRunnerRegistry registry) {
        URLClassLoader loader;
        try {
            URL jarUrl = jar.toUri().toURL();
            loader = new URLClassLoader(new URL[]{jarUrl}, parentClassLoader);
        } catch (IOException e) {
            logger.error("Failed to open runner plugin jar {} (skipping): {}", jar, e.getMessage(), e);
            return;
        }
        jarLoaders.add(loader);
        int installed = install(ServiceLoader.load(ActionRunnerProvider.class, loader), loader, registry);
        if (installed == 0) {
            logger.warn("No runner providers found in {}", jar.getFileName());
        } else {
            logger.info("Loaded {} runner provider(s) from {}", installed, jar.getFileName());
        }
    }

    /**
     * @param owner when set, providers defined by other loaders (the parent's) are skipped
     */
    private int install(ServiceLoader<ActionRunnerProvider> serviceLoader, ClassLoader owner,
                        ActionRunnerRegistry registry) {
        int installed = 0;
        Iterator<ActionRunnerProvider> providers = serviceLoader.iterator();
        while (true) {
            ActionRunnerProvider provider;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                provider = providers.next();
            } catch (ServiceConfigurationError e) {
                logger.error("Runner provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (owner != null && provider.getClass().getClassLoader() != owner) {
                continue;
            }
            try {
                provider.configure(configuration);
                registry.install(provider);
                loadedProviders.add(provider.getName());
                installed++;
            } catch (RuntimeException e) {
                logger.error("Runner provider {} failed to register (skipping): {}",
                        provider.getClass().getName(), e.getMessage(), e);
            }
        }
        return installed;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (URLClassLoader loader : jarLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        jarLoaders.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
