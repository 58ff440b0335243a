package org.learningjava.uniagent.config;

import org.learningjava.uniagent.domain.policy.PatchModePolicy;
import org.learningjava.uniagent.domain.service.feedback.FeedbackFormatter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    //plain domain objects tuned from uniagent.* properties
    @Bean
    FeedbackFormatter feedbackFormatter(UniAgentProperties props) {
        return new FeedbackFormatter(props.getLintMaxItems(), props.getSnippetMaxChars());
    }

    @Bean
    PatchModePolicy patchModePolicy(UniAgentProperties props) {
        return new PatchModePolicy(props.getPatch().getMinDocumentLength(), props.getPatch().getMaxIssues());
    }
}
