package com.leaderboard.hosted.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SubmissionExecutorConfig {

    @Bean(name = "submissionExecutor")
    public ThreadPoolTaskExecutor submissionExecutor(LeaderboardProperties properties) {
        LeaderboardProperties.Submission submission = properties.getSubmission();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(submission.getWorkerThreads());
        executor.setMaxPoolSize(submission.getWorkerThreads());
        executor.setQueueCapacity(submission.getQueueCapacity());
        executor.setThreadNamePrefix("submission-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
