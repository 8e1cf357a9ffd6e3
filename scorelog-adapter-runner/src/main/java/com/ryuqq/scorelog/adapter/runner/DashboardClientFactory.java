package com.ryuqq.scorelog.adapter.runner;

import com.ryuqq.scorelog.application.api.DashboardApi;
import com.ryuqq.scorelog.application.client.ClientContext;
import com.ryuqq.scorelog.application.client.DashboardClient;
import com.ryuqq.scorelog.core.spi.Gateway;

/**
 * {@link DashboardClient} 조립.
 *
 * <p>클라이언트마다 Dispatcher, Coordinator, 식별자 캐시를 하나씩 만들어 연결합니다.
 * 캐시는 클라이언트 인스턴스에 속하며 프로세스 전역으로 공유되지 않습니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class DashboardClientFactory {

    private DashboardClientFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 설정으로 클라이언트 생성.
     *
     * @param gateway 원격 Gateway
     * @param context 클라이언트 기본 범위
     * @return DashboardClient
     */
    public static DashboardClient create(Gateway gateway, ClientContext context) {
        return create(gateway, context, new LogDispatcherConfig(), new CoordinatorConfig(), new IdentifierCacheConfig());
    }

    /**
     * 설정을 지정해 클라이언트 생성.
     *
     * @param gateway 원격 Gateway
     * @param context 클라이언트 기본 범위
     * @param dispatcherConfig Dispatcher 설정
     * @param coordinatorConfig Coordinator 설정
     * @param cacheConfig 식별자 캐시 설정
     * @return DashboardClient
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public static DashboardClient create(
        Gateway gateway,
        ClientContext context,
        LogDispatcherConfig dispatcherConfig,
        CoordinatorConfig coordinatorConfig,
        IdentifierCacheConfig cacheConfig
    ) {
        DashboardApi api = new DashboardApi(gateway);
        return new DashboardClient(
            context,
            new BatchingLogDispatcher(api, dispatcherConfig),
            new BatchJobCoordinator(api, coordinatorConfig),
            new IdentifierResolutionCache(api, cacheConfig)
        );
    }
}
