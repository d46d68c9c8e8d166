package me.internalizable.modmanager.resolve;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.environment.ServerEnvironment;
import me.internalizable.modmanager.registry.ModRegistry;
import me.internalizable.modmanager.registry.RegistryException;
import me.internalizable.modmanager.registry.model.Dependency;
import me.internalizable.modmanager.registry.model.DependencyType;
import me.internalizable.modmanager.registry.model.Project;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a project's dependency graph and produces an install plan.
 *
 * <p>The plan is in pre-order: every project appears before its own
 * dependencies, and dependencies follow their declaration order. Each
 * project id is visited at most once per call, so cycles terminate.</p>
 *
 * <p>Registry failures on the root project propagate. Failures on any
 * dependency only drop that branch.</p>
 */
public class DependencyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyResolver.class);

    private static final String ARCHIVE_EXTENSION = ".jar";

    private final ModRegistry registry;
    private final boolean preferStable;
    private final boolean includeOptional;

    /**
     * Create a resolver.
     *
     * @param registry registry to query
     * @param preferStable prefer release versions when available
     * @param includeOptional follow optional dependencies as well as required ones
     */
    public DependencyResolver(@Nonnull ModRegistry registry, boolean preferStable, boolean includeOptional) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.preferStable = preferStable;
        this.includeOptional = includeOptional;
    }

    /**
     * Resolve a plan for the given environment.
     *
     * @param rootSlug slug or URL of the requested project
     * @param environment target environment
     * @return the plan, empty if the root has no compatible version
     * @throws RegistryException if the root project cannot be fetched
     */
    @Nonnull
    public List<ResolutionNode> resolve(@Nonnull String rootSlug, @Nonnull ServerEnvironment environment)
            throws RegistryException {
        return resolve(rootSlug, environment.gameVersion(), environment.loader());
    }

    /**
     * Resolve a plan.
     *
     * @param rootSlug slug or URL of the requested project
     * @param gameVersion target game version
     * @param loader target loader
     * @return the plan, empty if the root has no compatible version
     * @throws RegistryException if the root project cannot be fetched
     */
    @Nonnull
    public List<ResolutionNode> resolve(@Nonnull String rootSlug, @Nonnull String gameVersion, @Nonnull ModLoader loader)
            throws RegistryException {
        Objects.requireNonNull(rootSlug, "rootSlug");
        Objects.requireNonNull(gameVersion, "gameVersion");
        Objects.requireNonNull(loader, "loader");

        Set<String> visited = new HashSet<>();
        List<ResolutionNode> plan = new ArrayList<>();
        Deque<Dependency> pending = new ArrayDeque<>();

        Project root = registry.getProject(rootSlug);
        expand(root, registry.getVersions(root.slug(), gameVersion, loader), gameVersion, loader, visited, plan, pending);

        while (!pending.isEmpty()) {
            Dependency dependency = pending.pop();
            try {
                String projectId = projectIdOf(dependency);
                if (projectId == null || visited.contains(projectId)) {
                    continue;
                }
                Project project = registry.getProject(projectId);
                List<Version> versions = registry.getVersions(project.slug(), gameVersion, loader);
                expand(project, versions, gameVersion, loader, visited, plan, pending);
            } catch (RegistryException e) {
                LOGGER.warn("Could not resolve dependency {}: {}", describe(dependency), e.getMessage());
            }
        }

        LOGGER.debug("Resolved {} for {} {}: {}", rootSlug, gameVersion, loader,
                plan.stream().map(ResolutionNode::slug).collect(Collectors.toList()));
        return plan;
    }

    private void expand(
            Project project,
            List<Version> versions,
            String gameVersion,
            ModLoader loader,
            Set<String> visited,
            List<ResolutionNode> plan,
            Deque<Dependency> pending) {

        if (!visited.add(project.id())) {
            return;
        }

        List<Version> compatible = CompatibilityFilter.filter(versions, gameVersion, loader, preferStable);
        if (compatible.isEmpty()) {
            LOGGER.warn("No compatible version of {} for {} {}", project.slug(), gameVersion, loader);
            return;
        }

        Version best = compatible.get(0);
        plan.add(new ResolutionNode(project, best, selectFile(best)));

        List<Dependency> followed = best.dependencies().stream()
                .filter(this::isFollowed)
                .collect(Collectors.toList());
        // reversed so the first declared dependency is popped first
        for (int i = followed.size() - 1; i >= 0; i--) {
            pending.push(followed.get(i));
        }
    }

    private boolean isFollowed(Dependency dependency) {
        return dependency.type() == DependencyType.REQUIRED
                || (includeOptional && dependency.type() == DependencyType.OPTIONAL);
    }

    @Nullable
    private String projectIdOf(Dependency dependency) throws RegistryException {
        if (dependency.projectId() != null && !dependency.projectId().isBlank()) {
            return dependency.projectId();
        }
        if (dependency.versionId() != null && !dependency.versionId().isBlank()) {
            return registry.getVersion(dependency.versionId()).projectId();
        }
        return null;
    }

    private static String describe(Dependency dependency) {
        return dependency.projectId() != null ? dependency.projectId() : "version " + dependency.versionId();
    }

    /**
     * Pick the installable file of a version.
     *
     * <p>Primary file first, then the first mod archive, then whatever comes first.</p>
     *
     * @param version the version
     * @return the file, or null if the version has none
     */
    @Nullable
    public static VersionFile selectFile(@Nonnull Version version) {
        List<VersionFile> files = version.files();
        if (files.isEmpty()) {
            return null;
        }
        for (VersionFile file : files) {
            if (file.primary()) {
                return file;
            }
        }
        for (VersionFile file : files) {
            if (file.filename().toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION)) {
                return file;
            }
        }
        return files.get(0);
    }
}
