package me.internalizable.modmanager.testing;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.registry.ModRegistry;
import me.internalizable.modmanager.registry.RegistryException;
import me.internalizable.modmanager.registry.model.Dependency;
import me.internalizable.modmanager.registry.model.DependencyType;
import me.internalizable.modmanager.registry.model.Project;
import me.internalizable.modmanager.registry.model.SearchHit;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;
import me.internalizable.modmanager.registry.model.VersionType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link ModRegistry} serving projects and versions registered by a test.
 *
 * <p>Downloads write {@code "<filename>"} as the file content.</p>
 */
public final class InMemoryRegistry implements ModRegistry {

    public static final String GAME_VERSION = "1.20.1";

    private final Map<String, Project> projectsById = new LinkedHashMap<>();
    private final Map<String, List<Version>> versionsByProjectId = new HashMap<>();
    private final Map<String, Version> versionsById = new HashMap<>();
    private final Map<String, RegistryException.Kind> failingProjects = new HashMap<>();
    private final Set<String> failingVersionLists = new HashSet<>();
    private final Set<String> failingDownloads = new HashSet<>();
    private final List<String> downloads = new ArrayList<>();
    private final AtomicInteger versionRequests = new AtomicInteger();
    private final Map<String, CountDownLatch> versionGates = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gateArrivals = new ConcurrentHashMap<>();

    private volatile boolean reachable = true;

    // ==================== Fixture setup ====================

    public synchronized Project addProject(String id, String slug) {
        Project project = new Project(id, slug, slug.substring(0, 1).toUpperCase(Locale.ROOT) + slug.substring(1),
                "The " + slug + " mod");
        projectsById.put(id, project);
        versionsByProjectId.putIfAbsent(id, new ArrayList<>());
        return project;
    }

    public synchronized Version addVersion(Version version) {
        versionsByProjectId.computeIfAbsent(version.projectId(), ignored -> new ArrayList<>()).add(version);
        versionsById.put(version.id(), version);
        return version;
    }

    /**
     * Publish a fabric release for {@link #GAME_VERSION} with one primary jar.
     */
    public Version release(String projectId, String versionNumber, Dependency... dependencies) {
        String slug = projectsById.get(projectId).slug();
        return addVersion(version(projectId, slug + "-" + versionNumber, versionNumber, VersionType.RELEASE,
                List.of(GAME_VERSION), Instant.parse("2024-01-01T00:00:00Z"), Arrays.asList(dependencies),
                List.of(jar(slug + "-" + versionNumber + ".jar", true))));
    }

    public synchronized void clearVersions(String projectId) {
        versionsByProjectId.put(projectId, new ArrayList<>());
    }

    public synchronized void failProject(String idOrSlug, RegistryException.Kind kind) {
        failingProjects.put(idOrSlug, kind);
    }

    public synchronized void failVersionList(String idOrSlug) {
        failingVersionLists.add(idOrSlug);
    }

    public synchronized void failDownload(String filename) {
        failingDownloads.add(filename);
    }

    /**
     * Block version lookups of a project until the returned latch is released.
     */
    public CountDownLatch gateVersions(String slug) {
        CountDownLatch latch = new CountDownLatch(1);
        gateArrivals.put(slug, new CountDownLatch(1));
        versionGates.put(slug, latch);
        return latch;
    }

    /**
     * Wait until a caller is blocked on the gate of a project.
     */
    public boolean awaitGateReached(String slug, long timeout, TimeUnit unit) throws InterruptedException {
        return gateArrivals.get(slug).await(timeout, unit);
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public synchronized List<String> getDownloads() {
        return new ArrayList<>(downloads);
    }

    public int getVersionRequests() {
        return versionRequests.get();
    }

    // ==================== Model helpers ====================

    public static Version version(String projectId, String id, String versionNumber, VersionType type,
                                  List<String> gameVersions, Instant published,
                                  List<Dependency> dependencies, List<VersionFile> files) {
        return new Version(id, projectId, versionNumber, versionNumber, gameVersions, List.of("fabric"), type,
                published, dependencies, files);
    }

    public static VersionFile jar(String filename, boolean primary) {
        return new VersionFile("https://cdn.example.invalid/" + filename, filename, filename.length(), primary);
    }

    public static Dependency required(String projectId) {
        return new Dependency(projectId, null, DependencyType.REQUIRED);
    }

    public static Dependency optional(String projectId) {
        return new Dependency(projectId, null, DependencyType.OPTIONAL);
    }

    // ==================== ModRegistry ====================

    @Override
    public synchronized Project getProject(String slugOrUrl) throws RegistryException {
        RegistryException.Kind failure = failingProjects.get(slugOrUrl);
        if (failure != null) {
            throw new RegistryException(failure, "Simulated failure for " + slugOrUrl);
        }
        Project project = find(slugOrUrl);
        if (project == null) {
            throw new RegistryException(RegistryException.Kind.NOT_FOUND, "Not found: project/" + slugOrUrl);
        }
        if (failingProjects.containsKey(project.id()) || failingProjects.containsKey(project.slug())) {
            throw new RegistryException(failingProjects.getOrDefault(project.id(),
                    failingProjects.get(project.slug())), "Simulated failure for " + slugOrUrl);
        }
        return project;
    }

    @Override
    public List<Version> getVersions(String slug, String gameVersion, ModLoader loader) throws RegistryException {
        versionRequests.incrementAndGet();
        CountDownLatch gate = versionGates.get(slug);
        if (gate != null) {
            gateArrivals.get(slug).countDown();
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryException(RegistryException.Kind.NETWORK, "Interrupted", e);
            }
        }

        synchronized (this) {
            Project project = find(slug);
            if (project == null) {
                throw new RegistryException(RegistryException.Kind.NOT_FOUND, "Not found: project/" + slug + "/version");
            }
            if (failingVersionLists.contains(project.id()) || failingVersionLists.contains(project.slug())) {
                throw new RegistryException(RegistryException.Kind.HTTP_ERROR, "Simulated failure for " + slug);
            }
            return new ArrayList<>(versionsByProjectId.getOrDefault(project.id(), List.of()));
        }
    }

    @Override
    public synchronized Version getVersion(String versionId) throws RegistryException {
        Version version = versionsById.get(versionId);
        if (version == null) {
            throw new RegistryException(RegistryException.Kind.NOT_FOUND, "Not found: version/" + versionId);
        }
        return version;
    }

    @Override
    public synchronized List<SearchHit> searchProjects(String query, String gameVersion, int limit) {
        String needle = query.toLowerCase(Locale.ROOT);
        return projectsById.values().stream()
                .filter(p -> p.slug().contains(needle) || p.displayName().toLowerCase(Locale.ROOT).contains(needle))
                .limit(limit)
                .map(p -> new SearchHit(p.id(), p.slug(), p.title(), p.description(), 1000L,
                        gameVersion != null ? List.of(gameVersion) : List.of()))
                .collect(Collectors.toList());
    }

    @Override
    public boolean download(VersionFile file, Path destination) {
        synchronized (this) {
            if (failingDownloads.contains(file.filename())) {
                return false;
            }
            downloads.add(file.filename());
        }
        try {
            Files.writeString(destination, file.filename(), StandardCharsets.UTF_8);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public boolean isReachable() {
        return reachable;
    }

    private Project find(String idOrSlug) {
        Project byId = projectsById.get(idOrSlug);
        if (byId != null) {
            return byId;
        }
        for (Project project : projectsById.values()) {
            if (project.slug().equals(idOrSlug)) {
                return project;
            }
        }
        return null;
    }
}
