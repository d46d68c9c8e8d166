package me.internalizable.modmanager.api;

/**
 * Builder implementation for install options.
 */
public class InstallOptionsBuilder implements ModManagerAPI.InstallOptions.Builder {

    private boolean forceUpdate = false;
    private boolean autoUpdate = true;

    @Override
    public ModManagerAPI.InstallOptions.Builder forceUpdate(boolean forceUpdate) {
        this.forceUpdate = forceUpdate;
        return this;
    }

    @Override
    public ModManagerAPI.InstallOptions.Builder autoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
        return this;
    }

    @Override
    public ModManagerAPI.InstallOptions build() {
        return new InstallOptionsImpl(forceUpdate, autoUpdate);
    }

    private record InstallOptionsImpl(
            boolean forceUpdate,
            boolean autoUpdate
    ) implements ModManagerAPI.InstallOptions {

        @Override
        public boolean isForceUpdate() {
            return forceUpdate;
        }

        @Override
        public boolean isAutoUpdate() {
            return autoUpdate;
        }
    }
}
