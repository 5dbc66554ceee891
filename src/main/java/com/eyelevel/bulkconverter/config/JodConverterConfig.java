package com.eyelevel.bulkconverter.config;

import org.jodconverter.local.office.LocalOfficeManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures and manages the lifecycle of a local LibreOffice instance for document conversions.
 * One office process is started per configured port, so the port list bounds how many conversions
 * run in parallel regardless of the worker count.
 */
@Configuration
public class JodConverterConfig {

    /**
     * Creates and initializes a {@link LocalOfficeManager} bean. The OfficeManager controls
     * the running LibreOffice processes, managing their startup, shutdown, and task queue.
     *
     * @param officeHome           The file system path to the LibreOffice installation directory.
     * @param portNumbers          The ports the LibreOffice processes listen on.
     * @param taskExecutionTimeout The maximum time in milliseconds a single conversion task is allowed to run
     *                             before it is terminated.
     * @param taskQueueTimeout     The maximum time in milliseconds a conversion waits for a free office process.
     *
     * @return A fully configured and managed {@link LocalOfficeManager} instance.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public LocalOfficeManager localOfficeManager(@Value("${app.jodconverter.office.home}") String officeHome,
                                                 @Value("${app.jodconverter.office.port-numbers}") int[] portNumbers,
                                                 @Value("${app.jodconverter.office.task-execution-timeout}")
                                                 long taskExecutionTimeout,
                                                 @Value("${app.jodconverter.office.task-queue-timeout}")
                                                 long taskQueueTimeout) {
        return LocalOfficeManager.builder().officeHome(officeHome).portNumbers(portNumbers)
                                 .taskExecutionTimeout(taskExecutionTimeout)
                                 .taskQueueTimeout(taskQueueTimeout).build();
    }
}
