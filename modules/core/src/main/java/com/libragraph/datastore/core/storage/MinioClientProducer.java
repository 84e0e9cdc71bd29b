package com.libragraph.datastore.core.storage;

import com.libragraph.datastore.core.config.StorageConfig;
import io.minio.MinioClient;
import io.minio.http.HttpUtils;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.TimeUnit;

@ApplicationScoped
@IfBuildProperty(name = "datastore.storage.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "datastore.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "datastore.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "datastore.minio.secret-key")
    String secretKey;

    @Produces
    @Singleton
    public MinioClient minioClient(StorageConfig config) {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .region(config.region())
                .httpClient(httpClient(config.client()))
                .build();
    }

    static OkHttpClient httpClient(StorageConfig.Client client) {
        long connect = client.connectTimeout().toMillis();
        long read = client.readTimeout().toMillis();
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(client.maxPoolConnections());
        dispatcher.setMaxRequestsPerHost(client.maxPoolConnections());
        return HttpUtils.newDefaultHttpClient(connect, read, read)
                .newBuilder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(client.maxPoolConnections(), 5, TimeUnit.MINUTES))
                .build();
    }
}
