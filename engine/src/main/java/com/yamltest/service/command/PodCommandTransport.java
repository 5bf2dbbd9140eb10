package com.yamltest.service.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamltest.domain.CommandSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.CommandResult;
import com.yamltest.infra.ProcessResult;
import com.yamltest.infra.ShellQuoting;
import com.yamltest.k8s.Kubectl;
import com.yamltest.k8s.PodResolver;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the command in the selected pod:
 *   kubectl exec {pod} [-c container] -- sh -c "[cd 'dir' && ][export K='v'; ]{command}"
 *
 * kubectl exec folds the remote stderr into its own, so a successful run
 * reports an empty stderr.
 */
@Singleton
public class PodCommandTransport implements CommandTransport {

    private static final Logger log = LoggerFactory.getLogger(PodCommandTransport.class);

    @Inject Kubectl kubectl;
    @Inject PodResolver podResolver;
    @Inject ObjectMapper mapper;

    @Override
    public CommandResult execute(CommandSpec command, Source source) {
        String pod = podResolver.podName(source.selector());

        List<String> args = new ArrayList<>(List.of("exec", pod));
        if (source.container() != null) {
            args.add("-c");
            args.add(source.container());
        }
        args.addAll(List.of("--", "sh", "-c", remoteScript(command)));
        List<String> cmd = kubectl.command(source.selector(), args);

        log.debug("Executing pod command: {}", String.join(" ", cmd));
        ProcessResult result = kubectl.run(cmd);
        if (result.success()) {
            return CommandResults.of(mapper, result.stdout(), "", 0, command.parseJson());
        }
        log.debug("Pod command failed with exit code {}", result.exitCode());
        return CommandResults.of(mapper, result.stdout(), result.stderr(), result.exitCode(), command.parseJson());
    }

    static String remoteScript(CommandSpec command) {
        StringBuilder script = new StringBuilder();
        if (command.workingDir() != null) {
            script.append("cd ").append(ShellQuoting.quote(command.workingDir())).append(" && ");
        }
        command.env().forEach((key, value) ->
            script.append("export ").append(key).append('=').append(ShellQuoting.quote(value)).append("; "));
        script.append(command.command());
        return script.toString();
    }
}
