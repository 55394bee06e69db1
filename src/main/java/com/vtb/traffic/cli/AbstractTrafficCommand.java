package com.vtb.traffic.cli;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Общая часть подкоманд: контекст с хранилищем и потоки вывода picocli
 */
abstract class AbstractTrafficCommand implements Callable<Integer> {

    @ParentCommand
    protected MainCommand parent;

    @Spec
    protected CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        try (CliContext context = parent.openContext()) {
            return execute(context);
        }
    }

    protected abstract int execute(CliContext context) throws Exception;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
