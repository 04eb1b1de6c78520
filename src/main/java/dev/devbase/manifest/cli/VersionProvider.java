package dev.devbase.manifest.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        return new String[] {
            "devbase-manifest " + version,
            "JVM: ${java.version} (${java.vendor} ${java.vm.name})"
        };
    }
}
