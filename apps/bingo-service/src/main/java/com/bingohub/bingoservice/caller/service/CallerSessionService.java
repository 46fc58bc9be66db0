package com.bingohub.bingoservice.caller.service;

import com.bingohub.bingoservice.caller.domain.Session;
import com.bingohub.realtime.claim.ClaimResolution;
import com.bingohub.realtime.claim.ClaimView;
import com.bingohub.realtime.claim.GroupView;
import com.bingohub.realtime.claim.PrizeAllocation;
import com.bingohub.realtime.claim.WinPattern;
import com.bingohub.realtime.connection.ConnectionStatus;
import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import com.bingohub.realtime.sync.CallResult;
import com.bingohub.realtime.sync.CallState;

import java.util.List;

/**
 * 叫号方会话服务：会话生命周期、叫号写路径与声明判定。
 * 所有方法同步返回（内部等待事件循环结果），失败时抛出：
 *  - IllegalArgumentException：参数错误 / 会话或声明不存在
 *  - IllegalStateException：会话已结束 / 声明状态不允许
 *  - PersistenceException / TransportException：存储或广播不可用
 */
public interface CallerSessionService {

    /**
     * 开启会话（幂等）：已开启时直接返回；已结束的会话重新开启并沿用已叫号码。
     * initialPattern 可为 null（稍后再设置）。
     */
    Session open(String sessionId, String callerId, String gameType, WinPattern initialPattern);

    /** 结束会话：停止判定、关闭连接，元信息保留为 ENDED */
    Session end(String sessionId);

    Session getSession(String sessionId);

    CallResult callNumber(String sessionId, int number);

    /** 重置本局（代数 + 1） */
    CallState resetGame(String sessionId);

    CallState changePattern(String sessionId, WinPattern pattern);

    /** 存储中的权威叫号状态（供玩家补齐；已结束的会话也可读） */
    CallState state(String sessionId);

    ConnectionStatus connectionStatus(String sessionId);

    List<ClaimView> claims(String sessionId);

    List<GroupView> groups(String sessionId);

    ClaimResolution decide(String sessionId, String groupId, PrizeAllocation allocation);

    ClaimView reject(String sessionId, String claimId, String reason);

    /**
     * 代浏览器玩家提交声明：广播 claim-submitted，判定结果随后经频道推送。
     *
     * @return 分配的 claimId
     */
    String submitClaim(String sessionId, String playerId, String playerName, TicketSnapshot ticket, WinPattern pattern);
}
