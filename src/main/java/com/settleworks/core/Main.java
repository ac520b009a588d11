package com.settleworks.core;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.StructureStatus;
import com.settleworks.core.economy.TickResult;
import com.settleworks.core.managers.Settlement;
import com.settleworks.core.synchronization.SettlementLoop;

import java.util.Locale;

/**
 * Demo headless: crea un piccolo accampamento e lascia girare il loop per un po'.
 * Usage: {@code Main [seconds]}
 */
public class Main {

    public static void main(String[] args) throws InterruptedException {
        int seconds = args.length > 0 ? Integer.parseInt(args[0]) : 30;

        Settlement settlement = Settlement.createDefault();
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(10, 0, 10), StructureStatus.COMPLETE);
        Structure mill = settlement.seedStructure("LUMBER_MILL", GridPosition.of(14, 0, 10), StructureStatus.COMPLETE);
        settlement.seedStructure("HOUSE", GridPosition.of(10, 0, 14), StructureStatus.COMPLETE);
        settlement.seedStructure("HOUSE", GridPosition.of(12, 0, 14), StructureStatus.COMPLETE);
        settlement.getLedger().deposit(ResourceType.FOOD, 30);

        for (int i = 1; i <= 3; i++) settlement.registerSettler("settler_" + i);
        settlement.assignWorker("settler_1", farm.id());
        settlement.assignWorker("settler_2", mill.id());

        SettlementLoop loop = new SettlementLoop(settlement, settlement.getSettings().tickIntervalMillis(), Main::report);
        loop.start();
        Runtime.getRuntime().addShutdownHook(new Thread(loop::stop, "sw-shutdown"));

        Thread.sleep(seconds * 1000L);
        loop.stop();
    }

    private static void report(TickResult r) {
        System.out.println(String.format(Locale.ROOT, "[Tick %d] produced=%s consumed=%s morale=%.1f (%s)%s",
                r.tick(), r.produced(), r.consumed(), r.morale().morale(), r.morale().description(),
                r.starvationOccurred() ? " ⚠️ STARVATION" : ""));
    }
}
