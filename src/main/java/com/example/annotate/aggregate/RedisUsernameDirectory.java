package com.example.annotate.aggregate;

import com.example.annotate.config.AnnotateProps;
import com.example.annotate.identity.UsernameDirectory;
import com.example.annotate.store.StoreCalls;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RedisUsernameDirectory implements UsernameDirectory {

    private final ReactiveStringRedisTemplate redis;
    private final StoreCalls calls;

    public RedisUsernameDirectory(ReactiveStringRedisTemplate redis, AnnotateProps props) {
        this.redis = redis;
        this.calls = new StoreCalls("redis", props.store());
    }

    @Override
    public Mono<String> findUsername(String uid) {
        return calls.read(redis.<String, String>opsForHash().get(AggregateKeys.user(uid), AggregateKeys.USERNAME));
    }
}
