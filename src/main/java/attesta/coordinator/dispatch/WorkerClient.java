package attesta.coordinator.dispatch;

import attesta.coordinator.model.WorkerStatusReport;

import java.io.IOException;

/**
 * Remote TEE worker RPC.
 */
public interface WorkerClient {

    /**
     * Hand a partition to a worker.
     *
     * @return opaque job handle used for later status calls
     */
    String submit(DispatchRequest request) throws IOException;

    WorkerStatusReport status(String jobHandle) throws IOException;

    byte[] fetchResult(String resultHandle) throws IOException;
}
