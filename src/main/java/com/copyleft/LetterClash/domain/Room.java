package com.copyleft.LetterClash.domain;

import com.copyleft.LetterClash.domain.type.Language;
import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.type.RoomPhase;
import com.copyleft.LetterClash.domain.vo.RoomRules;
import com.copyleft.LetterClash.domain.vo.RosterEntry;
import com.copyleft.LetterClash.domain.vo.ScorePair;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 한 게임 세션의 상태. 모든 변경은 {@link #getLock()} 을 잡은 상태에서만 이루어져야 한다.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString(exclude = {"lock", "pendingAnswers"})
public class Room {

    private final String roomCode;   // 정규화된 방 코드 (대문자/숫자, 최대 6자)
    private String hostSessionId;    // 방장의 sessionId, 접근할 때마다 명단과 대조한다

    @Builder.Default
    private final List<Player> players = new ArrayList<>();

    @Setter
    private int maxPlayers;

    @Builder.Default
    private int currentRound = 1;

    private String letter;           // 이번 라운드 시작 글자 (방장 클라이언트가 선택)

    @Builder.Default
    private int roundSeconds = 60;

    private long deadline;           // epoch ms, 클라이언트 안내용

    @Setter
    @Builder.Default
    private Language language = Language.AR;

    @Builder.Default
    private RoomRules rules = RoomRules.defaults();

    @Builder.Default
    private final Map<PlayerRole, List<String>> pendingAnswers = new EnumMap<>(PlayerRole.class);

    @Builder.Default
    private ScorePair runningScore = ScorePair.ZERO;

    @Builder.Default
    private final List<ScorePair> roundHistory = new ArrayList<>();

    private int lastScoredRound;

    @Builder.Default
    private RoomPhase phase = RoomPhase.LOBBY;

    private boolean closed;          // 디렉터리에서 제거된 방

    @Builder.Default
    private final ReentrantLock lock = new ReentrantLock();

    public static Room create(String roomCode, int maxPlayers) {
        return Room.builder()
                .roomCode(roomCode)
                .maxPlayers(maxPlayers)
                .build();
    }

    public List<Player> getPlayers() {
        return List.copyOf(players);
    }

    public List<ScorePair> getRoundHistory() {
        return List.copyOf(roundHistory);
    }

    public int size() {
        return players.size();
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public boolean isFull() {
        return players.size() >= maxPlayers;
    }

    public boolean contains(String sessionId) {
        return findPlayer(sessionId).isPresent();
    }

    public Optional<Player> findPlayer(String sessionId) {
        return players.stream()
                .filter(p -> Objects.equals(p.getSessionId(), sessionId))
                .findFirst();
    }

    public Optional<Player> getHost() {
        if (hostSessionId == null) {
            return Optional.empty();
        }
        return findPlayer(hostSessionId);
    }

    public boolean isHost(String sessionId) {
        return getHost()
                .map(host -> host.getSessionId().equals(sessionId))
                .orElse(false);
    }

    /**
     * 방장이 없으면 입장자가 방장, 있으면 게스트가 된다.
     */
    public Player addPlayer(String sessionId, String name) {
        Player player = Player.of(sessionId, name);
        if (getHost().isEmpty()) {
            player.setRole(PlayerRole.HOST);
            this.hostSessionId = sessionId;
        }
        players.add(player);
        electHost();
        return player;
    }

    public Optional<Player> removePlayer(String sessionId) {
        Optional<Player> removed = findPlayer(sessionId);
        removed.ifPresent(players::remove);
        return removed;
    }

    /**
     * 방장이 없거나 명단에 없으면 명단의 첫 번째 플레이어를 방장으로 선출한다.
     *
     * @return 방장이 바뀌었으면 true
     */
    public boolean electHost() {
        if (getHost().isPresent()) {
            return false;
        }

        String previous = this.hostSessionId;
        if (players.isEmpty()) {
            this.hostSessionId = null;
            return previous != null;
        }

        Player newHost = players.get(0);
        for (Player p : players) {
            p.setRole(p == newHost ? PlayerRole.HOST : PlayerRole.GUEST);
        }
        this.hostSessionId = newHost.getSessionId();
        return !Objects.equals(previous, this.hostSessionId);
    }

    public List<RosterEntry> getRoster() {
        return players.stream()
                .map(Player::toRosterEntry)
                .toList();
    }

    public List<String> getSessionIds() {
        return players.stream()
                .map(Player::getSessionId)
                .toList();
    }

    /**
     * @return 클라이언트에 안내할 마감 시각 (epoch ms)
     */
    public long startRound(int round, int seconds, String letter, long now) {
        this.currentRound = round;
        this.roundSeconds = seconds;
        this.letter = letter;
        this.pendingAnswers.clear();
        this.deadline = now + seconds * 1000L;
        this.phase = RoomPhase.ROUND_ACTIVE;
        return deadline;
    }

    /**
     * @return 방장과 게스트 답안이 모두 모였으면 true
     */
    public boolean submitAnswers(PlayerRole role, List<String> answers) {
        pendingAnswers.put(role, List.copyOf(answers));
        return hasBothAnswers();
    }

    public boolean hasBothAnswers() {
        return pendingAnswers.containsKey(PlayerRole.HOST) && pendingAnswers.containsKey(PlayerRole.GUEST);
    }

    public Optional<List<String>> getPendingAnswers(PlayerRole role) {
        return Optional.ofNullable(pendingAnswers.get(role));
    }

    // 시간 종료 시 제출하지 않은 쪽은 빈 답안으로 채점한다
    public void fillMissingAnswers() {
        pendingAnswers.putIfAbsent(PlayerRole.HOST, List.of());
        pendingAnswers.putIfAbsent(PlayerRole.GUEST, List.of());
    }

    public boolean isRoundScored() {
        return lastScoredRound == currentRound;
    }

    public void applyRoundScore(ScorePair delta) {
        roundHistory.add(delta);
        runningScore = runningScore.plus(delta);
        lastScoredRound = currentRound;
        pendingAnswers.clear();
        phase = RoomPhase.SCORED;
    }

    public RoomRules mergeRules(Boolean requireLetter, Boolean dupZero) {
        this.rules = rules.merge(requireLetter, dupZero);
        return rules;
    }

    public void close() {
        this.closed = true;
    }
}
