package io.switchboard.cli;

import io.switchboard.core.alias.AliasService;
import io.switchboard.core.alias.AliasTable;
import io.switchboard.core.alias.ResolutionCache.CacheStats;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "aliases", description = "List aliases of configured providers")
public final class AliasesCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--stats", description = "Also print resolution cache statistics")
    boolean stats;

    public AliasesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        AliasService aliases = context.runtime().aliases();
        AliasTable table = aliases.table();
        Map<String, Map<String, String>> active = aliases.activeAliases(context.runtime().registry().activeProviders());
        if (active.isEmpty()) {
            System.out.println("No aliases configured");
        }
        active.forEach((provider, entries) -> {
            System.out.println(provider + ":");
            entries.forEach((alias, target) -> System.out.println(
                "  " + alias + " -> " + target + (table.isFallback(provider, alias) ? " (fallback)" : "")
            ));
        });
        if (stats) {
            CacheStats cache = aliases.cacheStats();
            System.out.printf(
                "Cache: size=%d/%d hits=%d misses=%d hitRate=%.2f generation=%d%n",
                cache.size(),
                cache.maxSize(),
                cache.hits(),
                cache.misses(),
                cache.hitRate(),
                cache.generation()
            );
        }
        return 0;
    }
}
